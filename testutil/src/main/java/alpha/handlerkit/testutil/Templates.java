package alpha.handlerkit.testutil;

import alpha.handlerkit.spi.TemplateException;
import alpha.handlerkit.spi.TemplateRenderer;

import java.io.IOException;
import java.util.Set;

/**
 * Factories of template renderers.
 */
public final class Templates {
    private Templates() {
        // Empty
    }
    
    /**
     * Returns a renderer writing the template names and the data.<p>
     * 
     * For example, names {@code ["a", "b"]} and data {@code "x"} renders
     * {@code "<a,b>x"}.
     * 
     * @return see JavaDoc
     */
    public static TemplateRenderer echo() {
        return echoFailingFor(Set.of());
    }
    
    /**
     * Returns a renderer like {@link #echo()}, except rendering fails with a
     * {@link TemplateException} if the data's {@code toString} contains any of
     * the given words.
     * 
     * @param words that fail rendering
     * 
     * @return see JavaDoc
     */
    public static TemplateRenderer echoFailingFor(Set<String> words) {
        var w = Set.copyOf(words);
        return (out, names, data) -> {
            String str = String.valueOf(data);
            if (w.stream().anyMatch(str::contains)) {
                throw new TemplateException("Can not render: " + str);
            }
            try {
                out.write("<" + String.join(",", names) + ">" + str);
            } catch (IOException e) {
                throw new TemplateException("Write failed.", e);
            }
        };
    }
    
    /**
     * Returns a renderer that always fails with a {@link TemplateException}.
     * 
     * @param message of the exception
     * @return see JavaDoc
     */
    public static TemplateRenderer failing(String message) {
        return (out, names, data) -> {
            throw new TemplateException(message);
        };
    }
}
