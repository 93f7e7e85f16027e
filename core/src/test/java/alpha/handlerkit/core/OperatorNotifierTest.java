package alpha.handlerkit.core;

import alpha.handlerkit.Config;
import alpha.handlerkit.handler.HttpError;
import alpha.handlerkit.handler.RequestMetadata;
import alpha.handlerkit.spi.Mail;
import alpha.handlerkit.spi.MailException;
import alpha.handlerkit.spi.TemplateException;
import alpha.handlerkit.testutil.LogRecorder;
import alpha.handlerkit.testutil.Logging;
import alpha.handlerkit.testutil.RecordingMailSender;
import alpha.handlerkit.testutil.Templates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;

import static java.lang.System.Logger.Level.ALL;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link OperatorNotifier}.<p>
 * 
 * The mail job runs on the test thread.
 */
final class OperatorNotifierTest
{
    private static final HttpError ERR = HttpError.internalServerError(
            "Database down", new IllegalStateException("pool closed"));
    
    private static final RequestMetadata META = new RequestMetadata(
            7, "POST", "/orders?id=1", "10.0.0.1", "curl/8.0");
    
    private static final Config PROD = Config.configuration()
            .appId("shop")
            .production(true)
            .operatorEmails(List.of("ops1@shop", "ops2@shop"))
            .build();
    
    private RecordingMailSender mailer;
    private LogRecorder logs;
    private java.util.logging.Level oldLevel;
    
    @BeforeEach
    void beforeEach() {
        mailer = new RecordingMailSender();
        oldLevel = Logging.setLevel(OperatorNotifier.class, ALL);
        logs = LogRecorder.startRecording();
    }
    
    @AfterEach
    void afterEach() {
        logs.stopRecording();
        Logging.resetLevel(OperatorNotifier.class, oldLevel);
    }
    
    private OperatorNotifier testee(Config cfg) {
        return new OperatorNotifier(cfg, Templates.echo(), mailer, Runnable::run);
    }
    
    @Test
    void notInProduction() {
        testee(Config.configuration()
                .operatorEmails(List.of("ops1@shop")).build())
                .report(ERR, META);
        assertThat(mailer.sent()).isEmpty();
        logs.assertContainsOnlyOnce(DEBUG, "Not in production, no email sent.");
    }
    
    @Test
    void noOperators() {
        testee(Config.configuration().production(true).build())
                .report(ERR, META);
        assertThat(mailer.sent()).isEmpty();
        logs.assertRemove(DEBUG, "No operator configured, no email sent.");
    }
    
    @Test
    void mailEachOperator() {
        testee(PROD).report(ERR, META);
        assertThat(mailer.sent()).extracting(Mail::to)
                .containsExactly("ops1@shop", "ops2@shop");
        Mail m = mailer.sent().get(0);
        assertThat(m.toName()).isEqualTo("Administrator");
        assertThat(m.from()).isEqualTo("errors@shop");
        assertThat(m.fromName()).isEqualTo("Error Notifications");
        assertThat(m.subject()).isEqualTo("An error occurred in the application");
        assertThat(m.html())
                .startsWith("<mails/error>")
                .contains("Error=500 Database down")
                .contains("java.lang.IllegalStateException: pool closed")
                .contains("UserMail=ops1@shop")
                .contains("AppId=shop")
                .contains("Method=POST")
                .contains("Path=/orders?id=1")
                .contains("RequestId=7");
        logs.assertRemove(DEBUG, "Sent an error email to the admin ops1@shop.")
            .assertRemove(DEBUG, "Sent an error email to the admin ops2@shop.");
    }
    
    @Test
    void renderFailure_nextOperatorTried() {
        new OperatorNotifier(PROD, Templates.echoFailingFor(Set.of("ops1@")),
                mailer, Runnable::run).report(ERR, META);
        assertThat(mailer.sent()).extracting(Mail::to).containsExactly("ops2@shop");
        logs.assertRemove(ERROR,
                "Cannot prepare an error email to the admin ops1@shop.",
                TemplateException.class);
    }
    
    @Test
    void sendFailure_nextOperatorTried() {
        mailer = new RecordingMailSender(Set.of("ops1@shop"));
        testee(PROD).report(ERR, META);
        assertThat(mailer.sent()).extracting(Mail::to).containsExactly("ops2@shop");
        logs.assertRemove(ERROR,
                "Cannot send an error email to the admin ops1@shop.",
                MailException.class);
    }
    
    @Test
    void executorRejects() {
        new OperatorNotifier(PROD, Templates.echo(), mailer, job -> {
            throw new RejectedExecutionException("Shut down");
        }).report(ERR, META);
        assertThat(mailer.sent()).isEmpty();
        logs.assertRemove(WARNING, "Error email dropped.",
                RejectedExecutionException.class);
    }
}
