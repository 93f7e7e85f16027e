package alpha.handlerkit.spi;

import static java.util.Objects.requireNonNull;

/**
 * An email with an HTML body.
 *
 * @param to recipient address
 * @param toName recipient name
 * @param from sender address
 * @param fromName sender name
 * @param subject of mail
 * @param html body
 */
public record Mail(
        String to, String toName,
        String from, String fromName,
        String subject, String html)
{
    /**
     * Constructs this object.
     *
     * @throws NullPointerException if any argument is {@code null}
     */
    public Mail {
        requireNonNull(to);
        requireNonNull(toName);
        requireNonNull(from);
        requireNonNull(fromName);
        requireNonNull(subject);
        requireNonNull(html);
    }
}
