package com.openmeet.oidc.user;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryUserDirectoryTest {

    private final InMemoryUserDirectory directory =
        new InMemoryUserDirectory(PasswordEncoderFactories.createDelegatingPasswordEncoder());

    @Test
    void authenticates_by_case_insensitive_email_within_the_tenant() {
        directory.register(new UserClaims("tenant-a", "101", "Alice@Example.com", "alice", null, null), "pw");

        assertThat(directory.authenticate("tenant-a", "alice@example.com", "pw"))
            .get().extracting(UserClaims::getUserId).isEqualTo("101");
        assertThat(directory.authenticate("tenant-a", "alice@example.com", "wrong")).isEmpty();
        assertThat(directory.authenticate("tenant-b", "alice@example.com", "pw")).isEmpty();
    }

    @Test
    void find_by_id_is_tenant_scoped() {
        directory.register(new UserClaims("tenant-a", "101", "a@x.com", null, null, null), "pw");
        directory.register(new UserClaims("tenant-b", "101", "b@x.com", null, null, null), "pw");

        assertThat(directory.findById("tenant-a", "101")).get().extracting(UserClaims::getEmail).isEqualTo("a@x.com");
        assertThat(directory.findById("tenant-b", "101")).get().extracting(UserClaims::getEmail).isEqualTo("b@x.com");
        assertThat(directory.findById("tenant-c", "101")).isEmpty();
    }

    @Test
    void email_is_unique_per_tenant() {
        directory.register(new UserClaims("tenant-a", "101", "a@x.com", null, null, null), "pw");

        assertThatThrownBy(() -> directory.register(new UserClaims("tenant-a", "102", "A@x.com", null, null, null), "pw"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
