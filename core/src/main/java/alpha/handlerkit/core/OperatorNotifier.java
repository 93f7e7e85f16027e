package alpha.handlerkit.core;

import alpha.handlerkit.Config;
import alpha.handlerkit.handler.HttpError;
import alpha.handlerkit.handler.Notifier;
import alpha.handlerkit.handler.RequestMetadata;
import alpha.handlerkit.spi.Mail;
import alpha.handlerkit.spi.MailException;
import alpha.handlerkit.spi.MailSender;
import alpha.handlerkit.spi.TemplateException;
import alpha.handlerkit.spi.TemplateRenderer;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Emails each configured operator about a failed request.<p>
 *
 * Nothing is sent unless the application runs in {@linkplain
 * Config#production() production} and at least one {@linkplain
 * Config#operatorEmails() operator address} is configured.<p>
 *
 * The mail body is rendered using the {@linkplain Config#errorMailTemplate()
 * error mail template}, given a {@code Map} with the following entries:
 *
 * <table>
 *   <caption>Template data</caption>
 *   <tr><th>Key</th><th>Value</th></tr>
 *   <tr><td>Error</td><td>Status code, message and stack trace</td></tr>
 *   <tr><td>UserMail</td><td>Address of the recipient</td></tr>
 *   <tr><td>AppId</td><td>{@link Config#appId()}</td></tr>
 *   <tr><td>Method</td><td>Request method</td></tr>
 *   <tr><td>Path</td><td>Request path and query</td></tr>
 *   <tr><td>RequestId</td><td>Request id</td></tr>
 * </table>
 *
 * Rendering and sending is done by an executor, by default one daemon thread
 * shared by all instances. A failure to render or send an email to one
 * operator is logged, and the next operator is tried. There are no retries.
 */
public final class OperatorNotifier implements Notifier
{
    private static final System.Logger LOG
            = System.getLogger(OperatorNotifier.class.getPackageName());

    private static final class DaemonThreadFactory implements ThreadFactory {
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("HandlerKitNotifier");
            return t;
        }
    }

    private static final ExecutorService MAILER
            = Executors.newSingleThreadExecutor(new DaemonThreadFactory());

    private final Config config;
    private final TemplateRenderer renderer;
    private final MailSender sender;
    private final Executor executor;

    /**
     * Constructs an {@code OperatorNotifier} using the default executor.
     *
     * @param config application configuration
     * @param renderer of the mail body
     * @param sender of mails
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public OperatorNotifier(
            Config config, TemplateRenderer renderer, MailSender sender) {
        this(config, renderer, sender, MAILER);
    }

    /**
     * Constructs an {@code OperatorNotifier}.
     *
     * @param config application configuration
     * @param renderer of the mail body
     * @param sender of mails
     * @param executor running the mail job
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public OperatorNotifier(
            Config config, TemplateRenderer renderer,
            MailSender sender, Executor executor) {
        this.config   = requireNonNull(config);
        this.renderer = requireNonNull(renderer);
        this.sender   = requireNonNull(sender);
        this.executor = requireNonNull(executor);
    }

    @Override
    public void report(HttpError error, RequestMetadata metadata) {
        if (!config.production()) {
            LOG.log(DEBUG, "Not in production, no email sent.");
            return;
        }
        if (config.operatorEmails().isEmpty()) {
            LOG.log(DEBUG, "No operator configured, no email sent.");
            return;
        }
        try {
            executor.execute(() -> mailAll(error, metadata));
        } catch (RejectedExecutionException e) {
            LOG.log(WARNING, "Error email dropped.", e);
        }
    }

    private void mailAll(HttpError error, RequestMetadata metadata) {
        final String desc = describe(error);
        for (String admin : config.operatorEmails()) {
            final String html;
            try {
                html = render(admin, desc, metadata);
            } catch (TemplateException | RuntimeException e) {
                LOG.log(ERROR, "Cannot prepare an error email to the admin " +
                        admin + ".", e);
                continue;
            }
            var mail = new Mail(admin, config.operatorName(),
                    config.mailFrom(), config.mailFromName(),
                    config.mailSubject(), html);
            try {
                sender.send(mail);
            } catch (MailException | RuntimeException e) {
                LOG.log(ERROR, "Cannot send an error email to the admin " +
                        admin + ".", e);
                continue;
            }
            LOG.log(DEBUG, () -> "Sent an error email to the admin " + admin + ".");
        }
    }

    private String render(String admin, String desc, RequestMetadata metadata)
            throws TemplateException {
        var data = Map.of(
                "Error",     desc,
                "UserMail",  admin,
                "AppId",     config.appId(),
                "Method",    metadata.method(),
                "Path",      metadata.path(),
                "RequestId", metadata.id());
        var buf = new StringWriter();
        renderer.render(buf, config.errorMailTemplate(), data);
        return buf.toString();
    }

    private static String describe(HttpError error) {
        var buf = new StringWriter();
        buf.append(error.statusCode() + " " + error.getMessage())
           .append(System.lineSeparator());
        try (var pw = new PrintWriter(buf)) {
            error.printStackTrace(pw);
        }
        return buf.toString();
    }
}
