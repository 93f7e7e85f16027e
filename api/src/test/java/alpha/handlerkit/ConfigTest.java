package alpha.handlerkit;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Config}.
 */
final class ConfigTest
{
    @Test
    void defaults() {
        var c = Config.DEFAULT;
        assertThat(c.appId()).isEqualTo("app");
        assertThat(c.production()).isFalse();
        assertThat(c.operatorEmails()).isEmpty();
        assertThat(c.mailFrom()).isEqualTo("errors@app");
        assertThat(c.errorMailTemplate()).containsExactly("mails/error");
        assertThat(c.compatibilityHeaders())
                .containsExactly(Map.entry("X-UA-Compatible", "chrome=1"));
    }
    
    @Test
    void mailFrom_derivedFromAppId() {
        assertThat(Config.configuration().appId("shop").build().mailFrom())
                .isEqualTo("errors@shop");
        assertThat(Config.configuration().appId("shop")
                .mailFrom("noreply@shop.example").build().mailFrom())
                .isEqualTo("noreply@shop.example");
    }
    
    @Test
    void builderIsImmutable() {
        var base = Config.configuration().production(true);
        var one = base.operatorEmails(List.of("a@shop")).build();
        var two = base.build();
        assertThat(one.operatorEmails()).containsExactly("a@shop");
        assertThat(two.operatorEmails()).isEmpty();
        assertThat(two.production()).isTrue();
    }
    
    @Test
    void toBuilder_keepsValues() {
        var c = Config.configuration().appId("shop").build()
                      .toBuilder().production(true).build();
        assertThat(c.appId()).isEqualTo("shop");
        assertThat(c.production()).isTrue();
    }
    
    @Test
    void emptyTemplate() {
        var b = Config.configuration();
        assertThatThrownBy(() -> b.errorMailTemplate(List.of()))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("No template names.");
    }
}
