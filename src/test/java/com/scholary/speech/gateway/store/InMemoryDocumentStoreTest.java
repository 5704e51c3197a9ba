package com.scholary.speech.gateway.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.speech.gateway.store.DocumentStore.Precondition;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryDocumentStoreTest {

  private InMemoryDocumentStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryDocumentStore();
  }

  @Test
  void update_shouldApplyAllWritesWhenPreconditionsHold() {
    store.set("users/a/usage/currentPeriod", "v1");

    boolean applied =
        store.update(
            Map.of("users/a/usage/currentPeriod", "v2", "usageHistory/2025-03/a", "archive"),
            List.of(
                new Precondition("users/a/usage/currentPeriod", "v1"),
                Precondition.absent("usageHistory/2025-03/a")));

    assertThat(applied).isTrue();
    assertThat(store.get("users/a/usage/currentPeriod", String.class)).contains("v2");
    assertThat(store.get("usageHistory/2025-03/a", String.class)).contains("archive");
  }

  @Test
  void update_shouldWriteNothingWhenAnyPreconditionFails() {
    store.set("users/a/usage/currentPeriod", "v1");
    store.set("usageHistory/2025-03/a", "existing");

    boolean applied =
        store.update(
            Map.of("users/a/usage/currentPeriod", "v2", "usageHistory/2025-03/a", "archive"),
            List.of(
                new Precondition("users/a/usage/currentPeriod", "v1"),
                Precondition.absent("usageHistory/2025-03/a")));

    assertThat(applied).isFalse();
    assertThat(store.get("users/a/usage/currentPeriod", String.class)).contains("v1");
    assertThat(store.get("usageHistory/2025-03/a", String.class)).contains("existing");
  }

  @Test
  void update_shouldRejectNullValuesBeforeWriting() {
    Map<String, Object> writes = new HashMap<>();
    writes.put("a", "1");
    writes.put("b", null);

    assertThatThrownBy(() -> store.update(writes, List.of()))
        .isInstanceOf(NullPointerException.class);
    assertThat(store.get("a", String.class)).isEmpty();
  }

  @Test
  void childKeys_shouldListDirectChildrenOnce() {
    store.set("users/bob/profile", "p");
    store.set("users/bob/usage/currentPeriod", "c");
    store.set("users/alice/profile", "p");
    store.set("users0", "sibling");
    store.set("usageHistory/2025-03/bob", "h");

    assertThat(store.childKeys("users")).containsExactly("alice", "bob");
    assertThat(store.childKeys("users/")).containsExactly("alice", "bob");
    assertThat(store.childKeys("usageHistory")).containsExactly("2025-03");
    assertThat(store.childKeys("nothing")).isEmpty();
  }

  @Test
  void get_shouldFailOnTypeMismatch() {
    store.set("x", 42);

    assertThatThrownBy(() -> store.get("x", String.class))
        .isInstanceOf(ClassCastException.class);
  }
}
