package alpha.handlerkit.handler;

import java.util.List;

import static java.lang.System.Logger.Level.ERROR;

/**
 * Fans out to many notifiers.
 *
 * @see Notifier#composite(Notifier...)
 */
final class CompositeNotifier implements Notifier
{
    private static final System.Logger LOG
            = System.getLogger(CompositeNotifier.class.getPackageName());

    private final List<Notifier> notifiers;

    CompositeNotifier(List<Notifier> notifiers) {
        this.notifiers = notifiers;
    }

    @Override
    public void report(HttpError error, RequestMetadata metadata) {
        for (Notifier n : notifiers) {
            try {
                n.report(error, metadata);
            } catch (RuntimeException e) {
                LOG.log(ERROR, () -> "Notifier failed: " + n, e);
            }
        }
    }
}
