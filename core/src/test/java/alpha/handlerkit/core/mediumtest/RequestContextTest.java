package alpha.handlerkit.core.mediumtest;

import alpha.handlerkit.core.mediumtest.util.AbstractRealTest;
import alpha.handlerkit.spi.FieldError;
import alpha.handlerkit.spi.FormDecodeException;
import alpha.handlerkit.spi.TemplateException;
import alpha.handlerkit.testutil.Templates;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.WARNING;
import static alpha.handlerkit.spi.FieldError.Kind.CONVERSION;
import static alpha.handlerkit.spi.FieldError.Kind.MISSING_REQUIRED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests of the request context's operations, through a real container.
 */
final class RequestContextTest extends AbstractRealTest
{
    private static final String FORM = "application/x-www-form-urlencoded";
    
    static final class Signup {
        @JsonProperty(required = true)
        public String name;
        public int age;
        public List<String> tags;
    }
    
    record Order(String id, LocalDate date) {
        // Empty
    }
    
    record Info(String method, String path, boolean get, boolean post, String agent) {
        // Empty
    }
    
    @Test
    void accessors() throws Exception {
        mount("/*", ctx -> ctx.emitJson(new Info(
                ctx.method(), ctx.path(), ctx.isGet(), ctx.isPost(),
                ctx.header("User-Agent").orElse("none"))));
        var rsp = get("/search?q=cats&page=2");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body())
                .contains("\"method\":\"GET\"")
                .contains("\"path\":\"/search?q=cats&page=2\"")
                .contains("\"get\":true")
                .contains("\"post\":false")
                .contains("\"agent\":\"Java-http-client");
    }
    
    @Test
    void redirect_relative() throws Exception {
        mount("/shop/*", ctx -> ctx.redirect("cart"));
        var rsp = get("/shop/items");
        assertThat(rsp.statusCode()).isEqualTo(302);
        assertThat(rsp.headers().firstValue("Location")).hasValue("/shop/cart");
        assertThat(rsp.body()).isEmpty();
    }
    
    @Test
    void redirect_permanent() throws Exception {
        mount("/*", ctx -> ctx.redirectPermanently("/home"));
        var rsp = get("/old");
        assertThat(rsp.statusCode()).isEqualTo(301);
        assertThat(rsp.headers().firstValue("Location")).hasValue("/home");
    }
    
    @Test
    void emitJson() throws Exception {
        mount("/*", ctx -> ctx.emitJson(new Order("A-1", LocalDate.of(2024, 1, 2))));
        var rsp = get("/");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.headers().firstValue("Content-Type"))
                .hasValueSatisfying(v -> assertThat(v)
                        .startsWith("application/json")
                        .containsIgnoringCase("charset=utf-8"));
        assertThat(rsp.body())
                .contains("\"id\":\"A-1\"")
                .contains("\"date\":\"2024-01-02\"");
    }
    
    @Test
    void renderTemplate() throws Exception {
        mount("/*", ctx -> ctx.renderTemplate(List.of("layout", "index"), "hello"));
        var rsp = get("/");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.headers().firstValue("Content-Type"))
                .hasValueSatisfying(v -> assertThat(v).startsWith("text/html"));
        assertThat(rsp.body()).isEqualTo("<layout,index>hello");
    }
    
    @Test
    void renderTemplate_failure() throws Exception {
        usingApplication(b -> b.templateRenderer(Templates.failing("no such template")));
        mount("/*", ctx -> ctx.renderTemplate(List.of("index"), null));
        var rsp = get("/");
        assertThat(rsp.statusCode()).isEqualTo(500);
        assertThat(rsp.body()).isEmpty();
        assertThat(notifier().take().error().getCause())
                .isExactlyInstanceOf(TemplateException.class);
        logRecorder().assertAwaitRemove(ERROR, "Request failed with 500: Failed to render [index].",
                TemplateException.class);
    }
    
    @Test
    void loadFormData_ignoresUnknownFields() throws Exception {
        mount("/*", ctx -> ctx.emitJson(ctx.loadFormData(Signup.class)));
        var rsp = post("/", FORM, "name=Ann&age=30&tags=a&tags=b&submit=Go&csrf=t0k3n");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body())
                .contains("\"name\":\"Ann\"")
                .contains("\"age\":30")
                .contains("\"tags\":[\"a\",\"b\"]")
                .doesNotContain("csrf");
    }
    
    @Test
    void loadFormData_queryParameters() throws Exception {
        mount("/*", ctx -> ctx.emitJson(ctx.loadFormData(Signup.class)));
        var rsp = get("/?name=Bo");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body())
                .contains("\"name\":\"Bo\"")
                .contains("\"age\":0");
    }
    
    @Test
    void loadFormData_missingRequired() throws Exception {
        mount("/*", ctx -> ctx.emitJson(ctx.loadFormData(Signup.class)));
        var rsp = post("/", FORM, "age=30&submit=Go");
        assertThat(rsp.statusCode()).isEqualTo(400);
        
        var cause = (FormDecodeException) notifier().take().error().getCause();
        assertThat(cause.errors())
                .extracting(FieldError::field, FieldError::kind)
                .containsExactly(
                    tuple("name", MISSING_REQUIRED));
        logRecorder().assertAwaitRemove(WARNING, "Request failed with 400: Invalid form data");
    }
    
    @Test
    void loadFormData_unknownAndRealErrors() throws Exception {
        mount("/*", ctx -> ctx.emitJson(ctx.loadFormData(Signup.class)));
        var rsp = post("/", FORM, "name=Ann&age=old&extra=1");
        assertThat(rsp.statusCode()).isEqualTo(400);
        
        var cause = (FormDecodeException) notifier().take().error().getCause();
        assertThat(cause.errors())
                .extracting(FieldError::field, FieldError::kind)
                .containsExactly(
                    tuple("age", CONVERSION));
        logRecorder().assertAwaitRemove(WARNING, "Request failed with 400: Invalid form data");
    }
    
    @Test
    void loadJsonBody() throws Exception {
        mount("/*", ctx -> {
            var o = ctx.loadJsonBody(Order.class);
            ctx.emitJson(new Order(o.id() + "!", o.date().plusDays(1)));
        });
        var rsp = post("/", "application/json",
                "{\"id\":\"B-2\",\"date\":\"2024-02-28\",\"unknown\":1}");
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.body())
                .contains("\"id\":\"B-2!\"")
                .contains("\"date\":\"2024-02-29\"");
    }
    
    @Test
    void loadJsonBody_malformed() throws Exception {
        mount("/*", ctx -> ctx.emitJson(ctx.loadJsonBody(Order.class)));
        var rsp = post("/", "application/json", "{\"id\":");
        assertThat(rsp.statusCode()).isEqualTo(400);
        assertThat(notifier().take().error().getCause())
                .isInstanceOf(JsonProcessingException.class);
        logRecorder().assertAwaitRemove(WARNING, "Request failed with 400: Invalid JSON body");
    }
}
