package com.repairdesk.sync.service.command;

import com.repairdesk.sync.client.EntityStoreClient;
import com.repairdesk.sync.exception.MutationRejectedException;
import com.repairdesk.sync.model.domain.Booking;
import com.repairdesk.sync.model.domain.BookingStatus;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.QuoteRequest;
import com.repairdesk.sync.model.domain.QuoteStatus;
import com.repairdesk.sync.model.domain.ViewScope;
import com.repairdesk.sync.model.dto.QuoteUpdateRequest;
import com.repairdesk.sync.service.session.ViewerSession;
import com.repairdesk.sync.service.session.ViewerSessionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static com.repairdesk.sync.helper.TestEntities.booking;
import static com.repairdesk.sync.helper.TestEntities.quote;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EntityCommandService Tests")
class EntityCommandServiceTest {

    @Mock
    private ViewerSessionRegistry registry;

    @Mock
    private EntityStoreClient storeClient;

    @Mock
    private ViewerSession session;

    @InjectMocks
    private EntityCommandService commandService;

    private void givenRole(ViewScope scope) {
        when(registry.require(scope.viewerId())).thenReturn(session);
        when(session.scope()).thenReturn(scope);
    }

    @Nested
    @DisplayName("Booking status")
    class BookingStatusUpdates {

        @Test
        @DisplayName("Should patch the status and apply the confirmed row to the caller's session")
        @SuppressWarnings("unchecked")
        void shouldUpdateStatus() {
            givenRole(ViewScope.admin("admin-1"));
            Booking updated = booking("b1", "u1", BookingStatus.CONFIRMED);
            when(storeClient.mutate(eq(EntityKind.BOOKING), eq("b1"), anyMap())).thenReturn(updated);

            Object result = commandService.updateBookingStatus("admin-1", "b1", BookingStatus.CONFIRMED);

            assertThat(result).isSameAs(updated);
            ArgumentCaptor<Map<String, Object>> patch = ArgumentCaptor.forClass(Map.class);
            verify(storeClient).mutate(eq(EntityKind.BOOKING), eq("b1"), patch.capture());
            assertThat(patch.getValue()).containsEntry("status", "confirmed").containsKey("updated_at");
            verify(session).applyConfirmed(updated);
        }

        @Test
        @DisplayName("Should refuse standard viewers without touching the store")
        void shouldRejectStandardViewer() {
            givenRole(ViewScope.standard("u1"));

            assertThatThrownBy(() -> commandService.updateBookingStatus("u1", "b1", BookingStatus.CANCELLED))
                    .isInstanceOf(MutationRejectedException.class)
                    .satisfies(e -> assertThat(((MutationRejectedException) e).isRetryable()).isFalse());
            verifyNoInteractions(storeClient);
        }

        @Test
        @DisplayName("A rejected write should leave the session untouched")
        void rejectedWriteNotApplied() {
            givenRole(ViewScope.admin("admin-1"));
            when(storeClient.mutate(eq(EntityKind.BOOKING), eq("b1"), anyMap()))
                    .thenThrow(new MutationRejectedException(EntityKind.BOOKING, "b1", "store down", true));

            assertThatThrownBy(() -> commandService.updateBookingStatus("admin-1", "b1", BookingStatus.CONFIRMED))
                    .isInstanceOf(MutationRejectedException.class);
            verify(session, never()).applyConfirmed(any());
        }

        @Test
        @DisplayName("Should require a status")
        void shouldRequireStatus() {
            assertThatThrownBy(() -> commandService.updateBookingStatus("admin-1", "b1", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Quote requests")
    class QuoteUpdates {

        @Test
        @DisplayName("Should send only the fields that were set")
        @SuppressWarnings("unchecked")
        void shouldSendPartialPatch() {
            givenRole(ViewScope.admin("admin-1"));
            QuoteRequest updated = quote("q1", "u1", QuoteStatus.QUOTED);
            when(storeClient.mutate(eq(EntityKind.QUOTE_REQUEST), eq("q1"), anyMap())).thenReturn(updated);
            QuoteUpdateRequest request = new QuoteUpdateRequest();
            request.setQuotedPrice(new BigDecimal("149.99"));
            request.setStatus(QuoteStatus.QUOTED);

            commandService.updateQuoteRequest("admin-1", "q1", request);

            ArgumentCaptor<Map<String, Object>> patch = ArgumentCaptor.forClass(Map.class);
            verify(storeClient).mutate(eq(EntityKind.QUOTE_REQUEST), eq("q1"), patch.capture());
            assertThat(patch.getValue())
                    .containsOnly(Map.entry("quoted_price", new BigDecimal("149.99")), Map.entry("status", "quoted"));
            verify(session).applyConfirmed(updated);
        }

        @Test
        @DisplayName("Should refuse an empty update")
        void shouldRejectEmptyUpdate() {
            assertThatThrownBy(() -> commandService.updateQuoteRequest("admin-1", "q1", new QuoteUpdateRequest()))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(storeClient);
        }

        @Test
        @DisplayName("Should turn a quote into a pending booking and accept the quote")
        @SuppressWarnings("unchecked")
        void shouldCreateBookingFromQuote() {
            givenRole(ViewScope.admin("admin-1"));
            QuoteRequest original = quote("q1", "u1", QuoteStatus.QUOTED);
            original.setQuotedPrice(new BigDecimal("99.00"));
            Booking created = booking("b-new", "u1", BookingStatus.PENDING);
            QuoteRequest accepted = quote("q1", "u1", QuoteStatus.ACCEPTED);
            when(storeClient.fetchOne(EntityKind.QUOTE_REQUEST, "q1")).thenReturn(Optional.of(original));
            when(storeClient.insert(eq(EntityKind.BOOKING), anyMap())).thenReturn(created);
            when(storeClient.mutate(EntityKind.QUOTE_REQUEST, "q1", Map.of("status", "accepted"))).thenReturn(accepted);

            Object result = commandService.createBookingFromQuote("admin-1", "q1");

            assertThat(result).isSameAs(created);
            ArgumentCaptor<Map<String, Object>> row = ArgumentCaptor.forClass(Map.class);
            verify(storeClient).insert(eq(EntityKind.BOOKING), row.capture());
            assertThat(row.getValue())
                    .containsEntry("user_id", "u1")
                    .containsEntry("device_type", "Pixel 7 cracked screen")
                    .containsEntry("preferred_time", "09:00")
                    .containsEntry("status", "pending")
                    .containsEntry("quote_request_id", "q1")
                    .containsEntry("quoted_price", new BigDecimal("99.00"))
                    .containsKey("preferred_date");
            verify(session).applyConfirmedInsert(created);
            verify(session).applyConfirmed(accepted);
        }

        @Test
        @DisplayName("Should reject a booking from a missing quote")
        void missingQuoteIsRejected() {
            givenRole(ViewScope.admin("admin-1"));
            when(storeClient.fetchOne(EntityKind.QUOTE_REQUEST, "q404")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> commandService.createBookingFromQuote("admin-1", "q404"))
                    .isInstanceOf(MutationRejectedException.class)
                    .hasMessageContaining("not found");
            verify(storeClient, never()).insert(any(), anyMap());
            verify(storeClient, never()).mutate(any(), anyString(), anyMap());
        }
    }
}
