package alpha.handlerkit.core;

import alpha.handlerkit.handler.HttpError;
import alpha.handlerkit.handler.RequestContext;
import alpha.handlerkit.handler.RequestMetadata;
import alpha.handlerkit.spi.FormDecodeException;
import alpha.handlerkit.spi.TemplateException;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static alpha.handlerkit.HttpConstants.HeaderName.LOCATION;
import static alpha.handlerkit.HttpConstants.HeaderName.USER_AGENT;
import static alpha.handlerkit.HttpConstants.Method.GET;
import static alpha.handlerkit.HttpConstants.Method.POST;
import static alpha.handlerkit.HttpConstants.StatusCode.THREE_HUNDRED_ONE;
import static alpha.handlerkit.HttpConstants.StatusCode.THREE_HUNDRED_TWO;
import static alpha.handlerkit.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.handlerkit.spi.FieldError.Kind.UNKNOWN_FIELD;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link RequestContext}.<p>
 *
 * All terminal writes go through a {@link ResponseGuard}. Writes with a body
 * produce the body in full before the guard is claimed, so a failure to
 * produce it leaves the response untouched.
 */
final class DefaultRequestContext implements RequestContext
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRequestContext.class.getPackageName());

    private static final AtomicLong SEQ = new AtomicLong();

    private static final String
            HTML = "text/html; charset=utf-8",
            JSON = "application/json; charset=utf-8";

    private final HttpServletRequest req;
    private final HttpServletResponse rsp;
    private final Application app;
    private final long id;
    private final String path;
    private final System.Logger log;
    private final ResponseGuard guard;
    private int bodyStatus;

    DefaultRequestContext(
            HttpServletRequest req, HttpServletResponse rsp, Application app) {
        this.req = req;
        this.rsp = rsp;
        this.app = app;
        this.id = SEQ.incrementAndGet();
        this.path = pathOf(req);
        this.log = new RequestLogger(LOG, id, req.getMethod(), path);
        this.guard = new ResponseGuard();
        this.bodyStatus = TWO_HUNDRED;
    }

    private static String pathOf(HttpServletRequest req) {
        String p = req.getRequestURI(),
               q = req.getQueryString();
        return q == null ? p : p + "?" + q;
    }

    /**
     * Sets the configured compatibility headers on the response.
     */
    void applyCompatibilityHeaders() {
        app.config().compatibilityHeaders().forEach(rsp::setHeader);
    }

    /**
     * Prepares the response for a terminal write on behalf of an error.<p>
     *
     * Unless the response is committed, it is reset (status, headers and
     * buffer) and the compatibility headers are set again. Headers set by the
     * failed handler are dropped even if no terminal write was made.<p>
     *
     * Subsequent writes with a body ({@link #emitJson(Object)} and {@link
     * #renderTemplate(List, Object)}) use the error's status code instead of
     * 200 (OK). For example, a not-found override rendering a page responds
     * 404 (Not Found).
     *
     * @param errorCode status code of the error
     *
     * @return {@code true} if a terminal write may be made,
     *         {@code false} if the response is committed
     */
    boolean reopen(int errorCode) {
        if (rsp.isCommitted()) {
            return false;
        }
        bodyStatus = errorCode;
        guard.owner().ifPresent(op -> log.log(DEBUG, () ->
                "Discarding response of \"" + op + "\"."));
        rsp.reset();
        applyCompatibilityHeaders();
        guard.release();
        return true;
    }

    @Override
    public HttpServletRequest request() {
        return req;
    }

    @Override
    public long id() {
        return id;
    }

    @Override
    public String method() {
        return req.getMethod();
    }

    @Override
    public boolean isPost() {
        return POST.equals(method());
    }

    @Override
    public boolean isGet() {
        return GET.equals(method());
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public Optional<String> header(String name) {
        return Optional.ofNullable(req.getHeader(name));
    }

    @Override
    public System.Logger logger() {
        return log;
    }

    @Override
    public RequestMetadata metadata() {
        return new RequestMetadata(id, method(), path,
                Objects.toString(req.getRemoteAddr(), ""),
                header(USER_AGENT).orElse(""));
    }

    @Override
    public void setHeader(String name, String value) {
        guard.requireUnclaimed("setHeader");
        rsp.setHeader(name, value);
    }

    @Override
    public void redirect(String path, boolean permanent) {
        requireNonNull(path);
        final String location = location(path);
        guard.claim("redirect");
        rsp.setStatus(permanent ? THREE_HUNDRED_ONE : THREE_HUNDRED_TWO);
        rsp.setHeader(LOCATION, location);
    }

    private String location(String target) {
        final URI t;
        try {
            t = URI.create(target);
        } catch (IllegalArgumentException e) {
            throw HttpError.internalServerError(
                    "Invalid redirect target: " + target, e);
        }
        if (t.isAbsolute() || target.startsWith("/")) {
            return target;
        }
        // The container may accept a request URI that URI does not
        String uri = req.getRequestURI(),
               dir = uri.substring(0, uri.lastIndexOf('/') + 1);
        try {
            return URI.create(dir).resolve(t).toString();
        } catch (IllegalArgumentException e) {
            return dir + target;
        }
    }

    @Override
    public void status(int code) {
        guard.claim("status");
        rsp.setStatus(code);
    }

    @Override
    public void emitJson(Object data) {
        guard.requireUnclaimed("emitJson");
        final byte[] body;
        try {
            body = Json.mapper().writeValueAsBytes(data);
        } catch (JsonProcessingException e) {
            throw HttpError.internalServerError(
                    "Failed to serialize response body.", e);
        }
        write("emitJson", JSON, body);
    }

    @Override
    public void renderTemplate(List<String> names, Object data) {
        requireNonNull(names);
        guard.requireUnclaimed("renderTemplate");
        var renderer = app.templateRenderer().orElseThrow(() ->
                HttpError.internalServerError(
                        "No template renderer configured.", null));
        var buf = new StringWriter();
        try {
            renderer.render(buf, names, data);
        } catch (TemplateException e) {
            throw HttpError.internalServerError(
                    "Failed to render " + names + ".", e);
        }
        write("renderTemplate", HTML, buf.toString().getBytes(UTF_8));
    }

    private void write(String operation, String contentType, byte[] body) {
        guard.claim(operation);
        rsp.setStatus(bodyStatus);
        rsp.setContentType(contentType);
        rsp.setContentLength(body.length);
        try {
            rsp.getOutputStream().write(body);
        } catch (IOException e) {
            throw HttpError.internalServerError(
                    "Failed to write response body.", e);
        }
    }

    @Override
    public <T> T loadFormData(Class<T> type) {
        requireNonNull(type);
        try {
            return app.formDecoder().decode(req.getParameterMap(), type);
        } catch (FormDecodeException e) {
            var rest = e.excluding(UNKNOWN_FIELD);
            if (rest.isPresent()) {
                throw HttpError.badRequest(
                        "Invalid form data: " + rest.get().getMessage(),
                        rest.get());
            }
            log.log(DEBUG, () -> "Ignored form fields: " + e.getMessage());
            return type.cast(e.value().orElse(null));
        }
    }

    @Override
    public <T> T loadJsonBody(Class<T> type) {
        requireNonNull(type);
        try (InputStream in = req.getInputStream()) {
            return Json.mapper().readValue(in, type);
        } catch (JsonProcessingException e) {
            throw HttpError.badRequest(
                    "Invalid JSON body: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw HttpError.internalServerError(
                    "Failed to read request body.", e);
        }
    }

    @Override
    public String toString() {
        return DefaultRequestContext.class.getSimpleName() +
                "{id=" + id + ", method=" + method() + ", path=" + path + "}";
    }
}
