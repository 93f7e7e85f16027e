package alpha.handlerkit.testutil;

import alpha.handlerkit.spi.Mail;
import alpha.handlerkit.spi.MailException;
import alpha.handlerkit.spi.MailSender;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A mail sender that records the mails sent.<p>
 * 
 * The sender may be told to fail for some recipients, in which case a {@link
 * MailException} is thrown and nothing is recorded for that mail.
 */
public final class RecordingMailSender implements MailSender
{
    private final List<Mail> sent = new CopyOnWriteArrayList<>();
    private final Set<String> failFor;
    
    /**
     * Constructs a sender that never fails.
     */
    public RecordingMailSender() {
        this(Set.of());
    }
    
    /**
     * Constructs a sender that fails for the given recipients.
     * 
     * @param failFor recipient addresses
     */
    public RecordingMailSender(Set<String> failFor) {
        this.failFor = Set.copyOf(failFor);
    }
    
    @Override
    public void send(Mail mail) throws MailException {
        if (failFor.contains(mail.to())) {
            throw new MailException("Mailbox unavailable: " + mail.to());
        }
        sent.add(mail);
    }
    
    /**
     * {@return all mails sent, in order}
     */
    public List<Mail> sent() {
        return List.copyOf(sent);
    }
}
