package alpha.handlerkit.core;

import java.text.MessageFormat;
import java.util.ResourceBundle;

/**
 * A logger prefixing each message with request details.<p>
 *
 * For example: {@code [#12 GET /orders?id=5] Request failed: 404 Not Found}.
 * <p>
 *
 * The resource bundle, if given, is ignored. Messages are not localized.
 */
final class RequestLogger implements System.Logger
{
    private final System.Logger delegate;
    private final String prefix;

    RequestLogger(System.Logger delegate, long id, String method, String path) {
        this.delegate = delegate;
        this.prefix = "[#" + id + " " + method + " " + path + "] ";
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public boolean isLoggable(Level level) {
        return delegate.isLoggable(level);
    }

    @Override
    public void log(Level level, ResourceBundle bundle, String msg, Throwable thrown) {
        delegate.log(level, prefix + msg, thrown);
    }

    @Override
    public void log(Level level, ResourceBundle bundle, String format, Object... params) {
        if (!delegate.isLoggable(level)) {
            return;
        }
        String msg = params == null || params.length == 0 ?
                format : MessageFormat.format(format, params);
        delegate.log(level, prefix + msg);
    }
}
