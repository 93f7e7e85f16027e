package alpha.handlerkit.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link ResponseGuard}.
 */
final class ResponseGuardTest
{
    private final ResponseGuard testee = new ResponseGuard();
    
    @Test
    void unclaimed() {
        assertThat(testee.isClaimed()).isFalse();
        assertThat(testee.owner()).isEmpty();
        testee.requireUnclaimed("setHeader");
    }
    
    @Test
    void claimTwice() {
        testee.claim("emitJson");
        assertThat(testee.owner()).contains("emitJson");
        assertThatThrownBy(() -> testee.claim("redirect"))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Response already written by \"emitJson\", can not also \"redirect\".");
        assertThat(testee.owner()).contains("emitJson");
    }
    
    @Test
    void release() {
        testee.claim("status");
        testee.release();
        assertThat(testee.isClaimed()).isFalse();
        testee.claim("renderTemplate");
        assertThat(testee.owner()).contains("renderTemplate");
    }
    
    @Test
    void nullOperation() {
        assertThatThrownBy(() -> testee.claim(null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThat(testee.isClaimed()).isFalse();
    }
}
