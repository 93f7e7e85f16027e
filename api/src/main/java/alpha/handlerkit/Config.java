package alpha.handlerkit;

import alpha.handlerkit.handler.Notifier;
import alpha.handlerkit.spi.TemplateRenderer;

import java.util.List;
import java.util.Map;

/**
 * Application configuration.<p>
 *
 * {@link Config#toBuilder()} allows for any configuration object to be used as
 * a template for a new instance. The static method {@link #configuration()} is
 * a shortcut for {@code Config.DEFAULT.toBuilder()}:
 *
 * <pre>{@code
 *   Config cfg = configuration()
 *           .appId("shop")
 *           .production(true)
 *           .operatorEmails(List.of("ops@example.com"))
 *           .build();
 * }</pre>
 *
 * The configuration is read by every request, but never written by one. It is
 * created once, during startup, by the serving process.
 *
 * @implSpec
 * The implementation is immutable.
 */
public interface Config
{
    /**
     * The default configuration.<p>
     *
     * This instance contains the following values:
     *
     * <pre>
     *   App id                 = "app"
     *   Production             = false
     *   Operator emails        = []
     *   Mail from              = "errors@" + app id
     *   Mail from name         = "Error Notifications"
     *   Operator name          = "Administrator"
     *   Mail subject           = "An error occurred in the application"
     *   Error mail template    = ["mails/error"]
     *   Compatibility headers  = {X-UA-Compatible=chrome=1}
     * </pre>
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * {@return the application's identifier}<p>
     *
     * The identifier is put in error notifications and, unless
     * {@link #mailFrom()} is configured explicitly, it is the domain of the
     * sender address of error notifications.
     */
    String appId();

    /**
     * {@return whether the application runs in production}<p>
     *
     * Outside of production, errors are only logged. No operator is notified by
     * email.
     */
    boolean production();

    /**
     * {@return the addresses to notify when a request fails}<p>
     *
     * One email is sent to each address, for each failed request (when in
     * {@linkplain #production() production}).
     */
    List<String> operatorEmails();

    /**
     * {@return the sender address of error notifications}<p>
     *
     * Unless set, this is {@code "errors@" + appId()}.
     */
    String mailFrom();

    /**
     * {@return the sender name of error notifications}
     */
    String mailFromName();

    /**
     * {@return the recipient name of error notifications}
     */
    String operatorName();

    /**
     * {@return the subject of error notifications}
     */
    String mailSubject();

    /**
     * {@return the template names rendering the body of an error notification}
     *
     * @see TemplateRenderer
     * @see Notifier
     */
    List<String> errorMailTemplate();

    /**
     * {@return headers set on each response before the handler is called}<p>
     *
     * By default, {@code X-UA-Compatible: chrome=1}. An empty map disables the
     * feature.
     */
    Map<String, String> compatibilityHeaders();

    /**
     * Returns a builder with all values set to the values of this instance.<p>
     *
     * The builder may be used to build a new configuration with changed
     * values. This instance is not modified.
     *
     * @return a builder
     */
    Builder toBuilder();

    /**
     * Is a shortcut for {@code DEFAULT.toBuilder()}.
     *
     * @return a builder
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Builder of a {@link Config}.<p>
     *
     * The builder is immutable. All setter methods return a new builder
     * instance.<p>
     *
     * Unless documented otherwise, the setters throw a
     * {@code NullPointerException} if given {@code null}.
     */
    interface Builder {
        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#appId()
         */
        Builder appId(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#production()
         */
        Builder production(boolean newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if any element is {@code null}
         * @see Config#operatorEmails()
         */
        Builder operatorEmails(List<String> newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#mailFrom()
         */
        Builder mailFrom(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#mailFromName()
         */
        Builder mailFromName(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#operatorName()
         */
        Builder operatorName(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#mailSubject()
         */
        Builder mailSubject(String newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws IllegalArgumentException if {@code newVal} is empty
         * @see Config#errorMailTemplate()
         */
        Builder errorMailTemplate(List<String> newVal);

        /**
         * Sets a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#compatibilityHeaders()
         */
        Builder compatibilityHeaders(Map<String, String> newVal);

        /**
         * Builds a configuration.
         *
         * @return a configuration
         */
        Config build();
    }
}
