package io.waypoint.core.navigation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.waypoint.core.model.ResolvedLocation;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Guards")
class GuardsTest {

    private static final ResolvedLocation HERE = ResolvedLocation.START;

    @Test
    @DisplayName("sync guards complete immediately")
    void syncCompletesImmediately() {
        CompletableFuture<GuardResult> result =
                Guards.sync((to, from) -> GuardResult.proceed()).check(HERE, HERE);

        assertThat(result).isCompleted();
        assertThat(result.join().isProceed()).isTrue();
    }

    @Test
    @DisplayName("callback guards complete when next is called")
    void callbackCompletesLater() {
        AtomicReference<GuardNext> parked = new AtomicReference<>();
        CompletableFuture<GuardResult> result =
                Guards.callback((to, from, next) -> parked.set(next)).check(HERE, HERE);
        assertThat(result).isNotDone();

        parked.get().redirect("/login?next=%2Fadmin");

        GuardResult verdict = result.join();
        assertThat(verdict.type()).isEqualTo(GuardResult.Type.REDIRECT);
        assertThat(verdict.redirectTarget().path()).isEqualTo("/login");
        assertThat(verdict.redirectTarget().query().first("next")).isEqualTo("/admin");
    }

    @Test
    @DisplayName("only the first call to next counts")
    void firstCallWins() {
        CompletableFuture<GuardResult> result = Guards.callback((to, from, next) -> {
                    next.abort();
                    next.proceed();
                })
                .check(HERE, HERE);

        assertThat(result.join().type()).isEqualTo(GuardResult.Type.ABORT);
    }

    @Test
    @DisplayName("deny and redirectTo build fixed verdicts")
    void fixedVerdicts() {
        assertThat(Guards.deny().check(HERE, HERE).join().type()).isEqualTo(GuardResult.Type.ABORT);
        assertThat(Guards.redirectTo("/home").check(HERE, HERE).join().redirectTarget().path())
                .isEqualTo("/home");
    }

    @Test
    @DisplayName("error verdicts require an error")
    void errorRequiresThrowable() {
        IllegalStateException boom = new IllegalStateException("boom");

        assertThat(GuardResult.error(boom).error()).isSameAs(boom);
        assertThat(GuardResult.error(boom).toString()).contains("ERROR");
        assertThatThrownBy(() -> GuardResult.error(null)).isInstanceOf(NullPointerException.class);
    }
}
