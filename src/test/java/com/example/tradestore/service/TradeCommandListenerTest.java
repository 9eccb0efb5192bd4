package com.example.tradestore.service;

import com.example.tradestore.TradeFixtures;
import com.example.tradestore.exception.TradeNotFoundException;
import com.example.tradestore.model.MutationType;
import com.example.tradestore.model.TradeCommand;
import com.example.tradestore.store.TradeDocumentStore;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.example.tradestore.TradeFixtures.context;
import static com.example.tradestore.TradeFixtures.json;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradeCommandListenerTest {

    @Mock
    private TradeDocumentStore tradeDocumentStore;

    @InjectMocks
    private TradeCommandListener listener;

    @Test
    void shouldApplySaveNewCommand() {
        ObjectNode trade = TradeFixtures.irSwap("T-1");
        TradeCommand command = TradeCommand.builder()
                .operation(MutationType.SAVE_NEW)
                .id("T-1")
                .context(context())
                .document(trade)
                .build();

        listener.handleCommand(command, "trades.commands", 0, 7L);

        verify(tradeDocumentStore).saveNew(context(), "T-1", trade);
    }

    @Test
    void shouldPassExpectedVersionOnUpdates() {
        ObjectNode patch = json("{\"common\": {\"book\": \"B2\"}}");
        TradeCommand partial = TradeCommand.builder()
                .operation(MutationType.SAVE_PARTIAL)
                .id("T-1")
                .context(context())
                .document(patch)
                .expectedVersion(4L)
                .build();

        TradeCommand update = TradeCommand.builder()
                .operation(MutationType.SAVE_UPDATE)
                .id("T-1")
                .context(context())
                .document(patch)
                .expectedVersion(4L)
                .build();

        listener.dispatch(partial);
        listener.dispatch(update);

        verify(tradeDocumentStore).savePartial(context(), "T-1", patch, 4L);
        verify(tradeDocumentStore).saveFullReplace(context(), "T-1", patch, 4L);
    }

    @Test
    void shouldApplyDeleteCommand() {
        listener.dispatch(TradeCommand.builder().operation(MutationType.DELETE).id("T-1").context(context()).build());

        verify(tradeDocumentStore).deleteById(context(), "T-1");
    }

    @Test
    void shouldRefusePurgeAndMissingOperation() {
        assertThatThrownBy(() -> listener.dispatch(TradeCommand.builder().operation(MutationType.PURGE).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> listener.dispatch(TradeCommand.builder().id("T-1").build()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(tradeDocumentStore);
    }

    @Test
    void shouldSwallowRejectedCommand() {
        when(tradeDocumentStore.savePartial(any(), anyString(), any(), any()))
                .thenThrow(new TradeNotFoundException("T-9"));
        TradeCommand command = TradeCommand.builder()
                .operation(MutationType.SAVE_PARTIAL)
                .id("T-9")
                .context(context())
                .document(json("{}"))
                .build();

        assertThatCode(() -> listener.handleCommand(command, "trades.commands", 0, 8L)).doesNotThrowAnyException();
    }

    @Test
    void shouldIgnoreUnreadablePayload() {
        assertThatCode(() -> listener.handleCommand(null, "trades.commands", 0, 9L)).doesNotThrowAnyException();

        verifyNoInteractions(tradeDocumentStore);
    }
}
