package com.example.lockbox.box.model;

import static com.example.lockbox.box.BoxFixtures.NOW;
import static com.example.lockbox.box.BoxFixtures.accepted;
import static com.example.lockbox.box.BoxFixtures.invited;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class GuardianTest {

  @Test
  void invitedGuardianCarriesPendingIdentity() {
    final Guardian guardian = invited("placeholder-1", "inv-1", false);

    assertThat(guardian.identity()).isInstanceOf(GuardianIdentity.Pending.class);
    assertThat(guardian.id()).isEqualTo("placeholder-1");
    assertThat(guardian.status()).isEqualTo(GuardianStatus.INVITED);
  }

  @Test
  void markViewedResolvesIdentityToUser() {
    final Guardian viewed = invited("placeholder-1", "inv-1", true).markViewed("user-1");

    assertThat(viewed.identity()).isEqualTo(new GuardianIdentity.Resolved("user-1"));
    assertThat(viewed.status()).isEqualTo(GuardianStatus.VIEWED);
    assertThat(viewed.invitationId()).isEqualTo("inv-1");
    assertThat(viewed.leadGuardian()).isTrue();
    assertThat(viewed.addedAt()).isEqualTo(NOW);
  }

  @Test
  void respondMovesAwaitingGuardianToAcceptedOrRejected() {
    final Guardian viewed = invited("placeholder-1", "inv-1", false).markViewed("user-1");

    assertThat(viewed.respond(true).status()).isEqualTo(GuardianStatus.ACCEPTED);
    assertThat(viewed.respond(false).status()).isEqualTo(GuardianStatus.REJECTED);
    assertThat(viewed.respond(false).isActive()).isFalse();
  }

  @Test
  void respondRejectsGuardianThatAlreadyResponded() {
    final Guardian guardian = accepted("user-1", "inv-1", false);

    assertThatThrownBy(() -> guardian.respond(false)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void identityMustMatchStatus() {
    assertThatThrownBy(
            () ->
                new Guardian(
                    new GuardianIdentity.Resolved("user-1"),
                    "inv-1",
                    "name",
                    "mail@example.com",
                    false,
                    GuardianStatus.INVITED,
                    NOW))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void withProfileKeepsIdentityAndStatus() {
    final Guardian viewed = invited("placeholder-1", "inv-1", false).markViewed("user-1");

    final Guardian updated = viewed.withProfile("New Name", "new@example.com", true);

    assertThat(updated.identity()).isEqualTo(viewed.identity());
    assertThat(updated.status()).isEqualTo(GuardianStatus.VIEWED);
    assertThat(updated.name()).isEqualTo("New Name");
    assertThat(updated.leadGuardian()).isTrue();
  }
}
