package alpha.handlerkit.spi;

/**
 * Delivers email.<p>
 *
 * HandlerKit does not ship a mail transport. The application adapts its
 * transport of choice to this interface.<p>
 *
 * The implementation must be thread-safe.
 */
@FunctionalInterface
public interface MailSender
{
    /**
     * Sends an email.
     *
     * @param mail to send
     *
     * @throws MailException if the mail was not accepted for delivery
     */
    void send(Mail mail) throws MailException;
}
