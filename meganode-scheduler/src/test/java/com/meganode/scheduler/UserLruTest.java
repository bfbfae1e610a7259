package com.meganode.scheduler;

import com.meganode.core.model.UserPk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class UserLruTest {

    private static final UserPk A = UserPk.fromLong(1);
    private static final UserPk B = UserPk.fromLong(2);
    private static final UserPk C = UserPk.fromLong(3);
    private static final Instant T0 = Instant.parse("2024-01-15T10:30:00Z");

    @Test
    @DisplayName("Touching a user makes it most recent")
    void touchReorders() {
        UserLru lru = new UserLru();
        lru.touch(A, T0);
        lru.touch(B, T0.plusSeconds(1));
        lru.touch(C, T0.plusSeconds(2));

        lru.touch(A, T0.plusSeconds(3));

        assertThat(lru.users()).containsExactly(B, C, A);
        assertThat(lru.leastRecent(2)).containsExactly(B, C);
        assertThat(lru.lastTouched(A)).isEqualTo(T0.plusSeconds(3));
    }

    @Test
    @DisplayName("Same-instant touches keep call order")
    void sameInstantKeepsOrder() {
        UserLru lru = new UserLru();
        lru.touch(C, T0);
        lru.touch(A, T0);
        lru.touch(B, T0);

        assertThat(lru.leastRecent(10)).containsExactly(C, A, B);
    }

    @Test
    @DisplayName("Remove reports whether the user was present")
    void remove() {
        UserLru lru = new UserLru();
        lru.touch(A, T0);

        assertThat(lru.remove(A)).isTrue();
        assertThat(lru.remove(A)).isFalse();
        assertThat(lru.isEmpty()).isTrue();
        assertThat(lru.contains(A)).isFalse();
    }
}
