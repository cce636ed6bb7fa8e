package org.pragmatica.options;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypedStoreTest {

    @Test
    void get_marksEntryRead() {
        var store = new TypedStore<>(OptionType.INTEGER);
        store.set("threads", 4);

        assertThat(store.isRead("threads")).isFalse();
        assertThat(store.get("threads")).isEqualTo(4);
        assertThat(store.isRead("threads")).isTrue();
    }

    @Test
    void set_resetsReadFlag() {
        var store = new TypedStore<>(OptionType.STRING);
        store.set("name", "first");
        store.get("name");

        store.set("name", "second");

        assertThat(store.isRead("name")).isFalse();
        assertThat(store.get("name")).isEqualTo("second");
    }

    @Test
    void get_fails_forMissingKey() {
        var store = new TypedStore<>(OptionType.DOUBLE);

        assertThatThrownBy(() -> store.get("missing"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void set_rejects_nullValue() {
        var store = new TypedStore<>(OptionType.STRING);

        assertThatThrownBy(() -> store.set("name", null))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void find_returnsEmpty_forMissingKey() {
        var store = new TypedStore<>(OptionType.BOOLEAN);

        assertThat(store.find("verbose")).isEmpty();
    }

    @Test
    void peek_doesNotMarkRead() {
        var store = new TypedStore<>(OptionType.BOOLEAN);
        store.set("verbose", true);

        assertThat(store.peek("verbose")).contains(true);
        assertThat(store.isRead("verbose")).isFalse();
    }

    @Test
    void findUnread_returnsFirstUnreadInInsertionOrder() {
        var store = new TypedStore<>(OptionType.INTEGER);
        store.set("a", 1);
        store.set("b", 2);
        store.set("c", 3);
        store.get("a");

        assertThat(store.findUnread()).contains("b");
        assertThat(store.unreadKeys()).containsExactly("b", "c");
    }

    @Test
    void findUnread_returnsEmpty_whenAllRead() {
        var store = new TypedStore<>(OptionType.INTEGER);
        store.set("a", 1);
        store.get("a");

        assertThat(store.findUnread()).isEmpty();
    }

    @Test
    void slot_createsZeroValue_andMarksRead() {
        var store = new TypedStore<>(OptionType.INTEGER);

        var ref = store.slot("counter");

        assertThat(ref.get()).isZero();
        assertThat(store.contains("counter")).isTrue();
        assertThat(store.isRead("counter")).isTrue();
    }

    @Test
    void slot_updatesValueInPlace() {
        var store = new TypedStore<>(OptionType.INTEGER);
        store.set("counter", 10);

        var ref = store.slot("counter");
        ref.set(ref.get() + 5);

        assertThat(store.peek("counter")).contains(15);
        assertThat(store.isRead("counter")).isTrue();
    }
}
