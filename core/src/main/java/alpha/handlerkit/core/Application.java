package alpha.handlerkit.core;

import alpha.handlerkit.Config;
import alpha.handlerkit.handler.Handler;
import alpha.handlerkit.handler.HttpError;
import alpha.handlerkit.handler.Notifier;
import alpha.handlerkit.handler.OverrideHandlers;
import alpha.handlerkit.spi.FormDecoder;
import alpha.handlerkit.spi.MailSender;
import alpha.handlerkit.spi.TemplateRenderer;
import jakarta.servlet.http.HttpServlet;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Is the process-wide home of everything a request needs.<p>
 *
 * The application holds the {@link Config}, the {@link OverrideHandlers}, and
 * the collaborators used by handlers and by the recovery logic. It is created
 * once, during startup, and then used to {@linkplain #adapt(Handler) adapt}
 * each handler into a servlet that the hosting container can mount:
 *
 * <pre>{@code
 *   Application app = Application.builder()
 *           .config(cfg)
 *           .templateRenderer(renderer)
 *           .mailSender(mailer)
 *           .build();
 *
 *   app.setNotFoundHandler(ctx -> ctx.renderTemplate(List.of("404"), null));
 *
 *   context.addServlet(new ServletHolder(app.adapt(ctx -> ...)), "/orders");
 *   context.addServlet(new ServletHolder(app.notFoundHandlerServlet()), "/");
 * }</pre>
 *
 * Unless a notifier is given explicitly, the application uses an {@link
 * OperatorNotifier} if a {@link MailSender} is given, otherwise {@link
 * Notifier#noOp()}. The operator notifier renders its mails with the
 * application's {@link TemplateRenderer}, which must then also be given.<p>
 *
 * The application is thread-safe.
 */
public final class Application
{
    /**
     * {@return a new builder}
     */
    public static Builder builder() {
        return new Builder();
    }

    private final Config config;
    private final OverrideHandlers overrides;
    private final TemplateRenderer renderer;
    private final FormDecoder forms;
    private final Notifier notifier;
    private final RecoveryRouter router;

    private Application(Builder b) {
        this.config    = b.config;
        this.overrides = new OverrideHandlers();
        this.renderer  = b.renderer;
        this.forms     = b.forms != null ? b.forms : new SchemaFormDecoder();
        this.notifier  = b.notifier != null ? b.notifier :
                         b.mailer   != null ? new OperatorNotifier(config, renderer, b.mailer) :
                                              Notifier.noOp();
        this.router    = new RecoveryRouter(overrides, notifier);
    }

    /**
     * Adapts a handler into a servlet.
     *
     * @param handler to adapt
     *
     * @return a servlet calling the handler
     *
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    public HandlerAdapter adapt(Handler handler) {
        return new HandlerAdapter(requireNonNull(handler), this, router);
    }

    /**
     * Returns a servlet that fails each request with a 404 (Not Found).<p>
     *
     * The servlet is meant to be mounted as the fallback of the hosting
     * router. It resolves its response just like a handler throwing
     * {@link HttpError#notFound()}; i.e., through the {@linkplain
     * #setNotFoundHandler(Handler) not-found override}, if registered.
     *
     * @return see JavaDoc
     */
    public HttpServlet notFoundHandlerServlet() {
        return adapt(ctx -> { throw HttpError.notFound(); });
    }

    /**
     * Registers the 500 override.
     *
     * @param handler the override
     *
     * @throws NullPointerException if {@code handler} is {@code null}
     *
     * @see OverrideHandlers#setErrorHandler(Handler)
     */
    public void setErrorHandler(Handler handler) {
        overrides.setErrorHandler(handler);
    }

    /**
     * Registers the 403 override.
     *
     * @param handler the override
     *
     * @throws NullPointerException if {@code handler} is {@code null}
     *
     * @see OverrideHandlers#setForbiddenHandler(Handler)
     */
    public void setForbiddenHandler(Handler handler) {
        overrides.setForbiddenHandler(handler);
    }

    /**
     * Registers the 404 override.
     *
     * @param handler the override
     *
     * @throws NullPointerException if {@code handler} is {@code null}
     *
     * @see OverrideHandlers#setNotFoundHandler(Handler)
     */
    public void setNotFoundHandler(Handler handler) {
        overrides.setNotFoundHandler(handler);
    }

    /**
     * {@return the configuration}
     */
    public Config config() {
        return config;
    }

    /**
     * {@return the override handlers}
     */
    public OverrideHandlers overrides() {
        return overrides;
    }

    /**
     * {@return the notifier}
     */
    public Notifier notifier() {
        return notifier;
    }

    Optional<TemplateRenderer> templateRenderer() {
        return Optional.ofNullable(renderer);
    }

    FormDecoder formDecoder() {
        return forms;
    }

    /**
     * Builder of an {@link Application}.<p>
     *
     * All setters throw a {@code NullPointerException} if given {@code null}.
     * The builder is not thread-safe.
     */
    public static final class Builder
    {
        private Config config = Config.DEFAULT;
        private TemplateRenderer renderer;
        private MailSender mailer;
        private FormDecoder forms;
        private Notifier notifier;

        private Builder() {
            // Empty
        }

        /**
         * Sets the configuration (default {@link Config#DEFAULT}).
         *
         * @param config the configuration
         * @return this
         */
        public Builder config(Config config) {
            this.config = requireNonNull(config);
            return this;
        }

        /**
         * Sets the template renderer (default none).
         *
         * @param renderer the renderer
         * @return this
         */
        public Builder templateRenderer(TemplateRenderer renderer) {
            this.renderer = requireNonNull(renderer);
            return this;
        }

        /**
         * Sets the sender of error notifications (default none).
         *
         * @param mailer the sender
         * @return this
         */
        public Builder mailSender(MailSender mailer) {
            this.mailer = requireNonNull(mailer);
            return this;
        }

        /**
         * Sets the form decoder (default {@link SchemaFormDecoder}).
         *
         * @param forms the decoder
         * @return this
         */
        public Builder formDecoder(FormDecoder forms) {
            this.forms = requireNonNull(forms);
            return this;
        }

        /**
         * Sets the notifier.<p>
         *
         * An explicitly set notifier replaces the one derived from the
         * {@linkplain #mailSender(MailSender) mail sender}. Use
         * {@link Notifier#composite(Notifier...)} to have both.
         *
         * @param notifier the notifier
         * @return this
         */
        public Builder notifier(Notifier notifier) {
            this.notifier = requireNonNull(notifier);
            return this;
        }

        /**
         * Builds the application.
         *
         * @return a new application
         *
         * @throws IllegalStateException
         *             if a mail sender is set, but no template renderer
         */
        public Application build() {
            if (mailer != null && renderer == null) {
                throw new IllegalStateException(
                        "A mail sender requires a template renderer.");
            }
            return new Application(this);
        }
    }
}
