package com.repairdesk.sync.service.view;

import com.repairdesk.sync.model.domain.Booking;
import com.repairdesk.sync.model.domain.BookingStatus;
import com.repairdesk.sync.model.domain.ChangeEvent;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.TrackedEntity;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.ViewDelta;
import com.repairdesk.sync.model.dto.ViewDelta.Delta;
import com.repairdesk.sync.model.dto.ViewSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.repairdesk.sync.helper.TestEntities.booking;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ViewReconciler Tests")
class ViewReconcilerTest {

    private final ViewReconciler reconciler = new ViewReconciler();

    private static List<String> ids(List<TrackedEntity> rows) {
        return rows.stream().map(TrackedEntity::getId).toList();
    }

    @Nested
    @DisplayName("Admin viewer")
    class AdminViewer {

        private EntityViewStore store;

        @BeforeEach
        void setUp() {
            store = new EntityViewStore(EntityKind.BOOKING, ViewScope.admin("admin-1"));
        }

        @Test
        @DisplayName("Should put a foreign insert into all but not into mine")
        void foreignInsertGoesToAllOnly() {
            ViewDelta delta = reconciler.apply(store, ChangeEvent.insert(booking("b1", "u1", BookingStatus.PENDING)));

            assertThat(delta.all()).isEqualTo(Delta.INSERTED);
            assertThat(delta.mine()).isEqualTo(Delta.NONE);
            ViewSnapshot snapshot = store.snapshot();
            assertThat(ids(snapshot.all())).containsExactly("b1");
            assertThat(snapshot.mine()).isEmpty();
        }

        @Test
        @DisplayName("Should put an own insert into both collections")
        void ownInsertGoesToBoth() {
            ViewDelta delta = reconciler.apply(store, ChangeEvent.insert(booking("b1", "admin-1", BookingStatus.PENDING)));

            assertThat(delta).isEqualTo(new ViewDelta(Delta.INSERTED, Delta.INSERTED));
            assertThat(ids(store.snapshot().mine())).containsExactly("b1");
        }

        @Test
        @DisplayName("Should keep newest inserts first and updates in place")
        void shouldKeepOrdering() {
            reconciler.apply(store, ChangeEvent.insert(booking("b1", "u1", BookingStatus.PENDING, 1)));
            reconciler.apply(store, ChangeEvent.insert(booking("b2", "u2", BookingStatus.PENDING, 2)));
            reconciler.apply(store, ChangeEvent.insert(booking("b3", "u1", BookingStatus.PENDING, 3)));

            reconciler.apply(store, ChangeEvent.updateOf(booking("b1", "u1", BookingStatus.CONFIRMED, 1)));

            List<TrackedEntity> all = store.snapshot().all();
            assertThat(ids(all)).containsExactly("b3", "b2", "b1");
            assertThat(((Booking) all.get(2)).getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        }

        @Test
        @DisplayName("Should keep mine a subset of all through inserts, updates and deletes")
        void mineStaysSubsetOfAll() {
            reconciler.apply(store, ChangeEvent.insert(booking("b1", "admin-1", BookingStatus.PENDING, 1)));
            reconciler.apply(store, ChangeEvent.insert(booking("b2", "u2", BookingStatus.PENDING, 2)));
            reconciler.apply(store, ChangeEvent.insert(booking("b3", "admin-1", BookingStatus.PENDING, 3)));
            reconciler.apply(store, ChangeEvent.delete(EntityKind.BOOKING, "b3", null));
            reconciler.apply(store, ChangeEvent.updateOf(booking("b1", "admin-1", BookingStatus.COMPLETED, 1)));

            ViewSnapshot snapshot = store.snapshot();
            assertThat(ids(snapshot.all())).containsAll(ids(snapshot.mine()));
            assertThat(ids(snapshot.mine())).containsExactly("b1");
            assertThat(ids(snapshot.all())).containsExactly("b2", "b1");
        }
    }

    @Nested
    @DisplayName("Standard viewer")
    class StandardViewer {

        private EntityViewStore store;

        @BeforeEach
        void setUp() {
            store = new EntityViewStore(EntityKind.BOOKING, ViewScope.standard("u1"));
        }

        @Test
        @DisplayName("Should ignore rows of other users")
        void shouldIgnoreForeignInsert() {
            ViewDelta delta = reconciler.apply(store, ChangeEvent.insert(booking("b9", "u2", BookingStatus.PENDING)));

            assertThat(delta.changedAnything()).isFalse();
            assertThat(delta.all()).isNull();
            assertThat(store.snapshot().mine()).isEmpty();
            assertThat(store.snapshot().all()).isNull();
            assertThat(store.snapshot().version()).isZero();
        }

        @Test
        @DisplayName("Applying the same insert twice should leave a single row")
        void repeatedInsertIsIdempotent() {
            ChangeEvent insert = ChangeEvent.insert(booking("b1", "u1", BookingStatus.PENDING));

            ViewDelta first = reconciler.apply(store, insert);
            ViewDelta second = reconciler.apply(store, insert);

            assertThat(first.mine()).isEqualTo(Delta.INSERTED);
            assertThat(second.mine()).isEqualTo(Delta.REPLACED);
            assertThat(ids(store.snapshot().mine())).containsExactly("b1");
        }

        @Test
        @DisplayName("Should ignore an update for a row it never saw")
        void shouldIgnoreUpdateOfUnknownRow() {
            ViewDelta delta = reconciler.apply(store, ChangeEvent.updateOf(booking("b1", "u1", BookingStatus.CONFIRMED)));

            assertThat(delta.changedAnything()).isFalse();
            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("Deleting twice should remove once")
        void repeatedDeleteIsIdempotent() {
            reconciler.apply(store, ChangeEvent.insert(booking("b1", "u1", BookingStatus.PENDING)));

            ViewDelta first = reconciler.apply(store, ChangeEvent.delete(EntityKind.BOOKING, "b1", null));
            ViewDelta second = reconciler.apply(store, ChangeEvent.delete(EntityKind.BOOKING, "b1", null));

            assertThat(first.mine()).isEqualTo(Delta.REMOVED);
            assertThat(second.changedAnything()).isFalse();
            assertThat(store.snapshot().mine()).isEmpty();
        }

        @Test
        @DisplayName("Should drop a row whose owner moved away")
        void shouldDropRowOnOwnerChange() {
            reconciler.apply(store, ChangeEvent.insert(booking("b1", "u1", BookingStatus.PENDING)));

            ViewDelta delta = reconciler.apply(store, ChangeEvent.updateOf(booking("b1", "u2", BookingStatus.PENDING)));

            assertThat(delta.mine()).isEqualTo(Delta.REMOVED);
            assertThat(store.contains("b1")).isFalse();
        }
    }

    @Nested
    @DisplayName("Full snapshot install")
    class ReplaceAll {

        @Test
        @DisplayName("Should filter invisible rows, drop duplicate ids and sort newest first")
        void shouldFilterDedupeAndSort() {
            EntityViewStore store = new EntityViewStore(EntityKind.BOOKING, ViewScope.standard("u1"));
            reconciler.apply(store, ChangeEvent.insert(booking("old", "u1", BookingStatus.PENDING)));

            reconciler.replaceAll(store, List.of(
                    booking("b1", "u1", BookingStatus.PENDING, 1),
                    booking("b2", "u2", BookingStatus.PENDING, 5),
                    booking("b3", "u1", BookingStatus.PENDING, 3),
                    booking("b1", "u1", BookingStatus.CONFIRMED, 1)));

            ViewSnapshot snapshot = store.snapshot();
            assertThat(ids(snapshot.mine())).containsExactly("b3", "b1");
            assertThat(((Booking) snapshot.mine().get(1)).getStatus()).isEqualTo(BookingStatus.CONFIRMED);
            assertThat(snapshot.syncedAt()).isNotNull();
            assertThat(snapshot.version()).isEqualTo(2);
        }

        @Test
        @DisplayName("Events after an install should land on top of the snapshot")
        void eventsApplyAfterInstall() {
            EntityViewStore store = new EntityViewStore(EntityKind.BOOKING, ViewScope.admin("admin-1"));
            reconciler.replaceAll(store, List.of(
                    booking("b1", "u1", BookingStatus.PENDING, 1),
                    booking("b2", "u2", BookingStatus.PENDING, 2)));

            reconciler.apply(store, ChangeEvent.insert(booking("b3", "u3", BookingStatus.PENDING, 3)));

            assertThat(ids(store.snapshot().all())).containsExactly("b3", "b2", "b1");
        }
    }
}
