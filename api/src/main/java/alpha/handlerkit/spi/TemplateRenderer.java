package alpha.handlerkit.spi;

import java.io.Writer;
import java.util.List;

/**
 * Renders named templates.<p>
 *
 * HandlerKit does not ship a template engine. The application adapts the
 * engine of its choice to this interface. The renderer is used for HTML
 * responses ({@code RequestContext.renderTemplate}) and for the body of error
 * notifications sent to operators.<p>
 *
 * The implementation must be thread-safe.
 */
@FunctionalInterface
public interface TemplateRenderer
{
    /**
     * Renders templates.<p>
     *
     * How many templates are given, and how they relate to each other (layout
     * and content, for example) is up to the implementation and the
     * application.
     *
     * @param out where to write the output
     * @param names of templates
     * @param data passed to the templates
     *
     * @throws TemplateException if rendering fails
     */
    void render(Writer out, List<String> names, Object data) throws TemplateException;
}
