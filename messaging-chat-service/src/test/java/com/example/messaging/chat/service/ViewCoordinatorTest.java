package com.example.messaging.chat.service;

import com.example.messaging.chat.support.TestClock;
import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.dto.StateChangeEvent;
import com.example.messaging.shared.dto.ViewState;
import com.example.messaging.shared.exception.InvalidInputException;
import com.example.messaging.shared.util.Constants.LayoutMode;
import com.example.messaging.shared.util.Constants.StateChangeType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViewCoordinatorTest {

    private ViewCoordinator coordinator;
    private final List<StateChangeEvent> events = Collections.synchronizedList(new ArrayList<>());
    private Disposable subscription;

    @BeforeEach
    void setUp() {
        StateChangePublisher publisher = new StateChangePublisher(new TestClock(Instant.parse("2025-03-01T12:00:00Z")));
        subscription = publisher.events().subscribe(events::add);
        coordinator = new ViewCoordinator(publisher, new AppProperties());
    }

    @AfterEach
    void tearDown() {
        subscription.dispose();
    }

    @Test
    void startsOnDesktopWithNothingSelected() {
        ViewState state = coordinator.currentState();

        assertThat(state.getLayoutMode()).isEqualTo(LayoutMode.DESKTOP);
        assertThat(state.getSelectedConversationId()).isNull();
        assertThat(state.isListVisible()).isTrue();
        assertThat(state.isChatVisible()).isTrue();
    }

    @Test
    void selectingOnDesktopShowsBothPanes() {
        ViewState state = coordinator.selectConversation("conv-a");

        assertThat(state).isEqualTo(new ViewState("conv-a", LayoutMode.DESKTOP));
        assertThat(coordinator.isViewing("conv-a")).isTrue();
        assertThat(coordinator.isViewing("conv-b")).isFalse();
    }

    @Test
    void mobileNavigationBetweenListAndChat() {
        coordinator.onViewportResize(390);
        assertThat(coordinator.currentState().getLayoutMode()).isEqualTo(LayoutMode.MOBILE_LIST);

        ViewState chat = coordinator.selectConversation("conv-a");
        assertThat(chat.getLayoutMode()).isEqualTo(LayoutMode.MOBILE_CHAT);
        assertThat(chat.isListVisible()).isFalse();
        assertThat(chat.isChatVisible()).isTrue();

        ViewState list = coordinator.goBack();
        assertThat(list).isEqualTo(new ViewState(null, LayoutMode.MOBILE_LIST));
        assertThat(coordinator.isViewing("conv-a")).isFalse();
    }

    @Test
    void shrinkingKeepsSelectionButHidesChat() {
        coordinator.selectConversation("conv-a");

        ViewState state = coordinator.onViewportResize(500);

        assertThat(state).isEqualTo(new ViewState("conv-a", LayoutMode.MOBILE_LIST));
        assertThat(coordinator.isViewing("conv-a")).isFalse();
    }

    @Test
    void wideningFromMobileChatKeepsSelection() {
        coordinator.onViewportResize(390);
        coordinator.selectConversation("conv-a");

        ViewState state = coordinator.onViewportResize(1280);

        assertThat(state).isEqualTo(new ViewState("conv-a", LayoutMode.DESKTOP));
    }

    @Test
    void breakpointWidthIsDesktop() {
        assertThat(coordinator.onViewportResize(768).getLayoutMode()).isEqualTo(LayoutMode.DESKTOP);
        assertThat(coordinator.onViewportResize(767).getLayoutMode()).isEqualTo(LayoutMode.MOBILE_LIST);
    }

    @Test
    void backOnDesktopIsNoOp() {
        coordinator.selectConversation("conv-a");
        events.clear();

        ViewState state = coordinator.goBack();

        assertThat(state).isEqualTo(new ViewState("conv-a", LayoutMode.DESKTOP));
        assertThat(events).isEmpty();
    }

    @Test
    void invalidInputLeavesStateUnchanged() {
        assertThatThrownBy(() -> coordinator.selectConversation(" "))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> coordinator.onViewportResize(0))
                .isInstanceOf(InvalidInputException.class);

        assertThat(coordinator.currentState()).isEqualTo(ViewState.initial());
    }

    @Test
    void publishesOnlyActualChanges() {
        coordinator.onViewportResize(1440);
        coordinator.selectConversation("conv-a");
        coordinator.selectConversation("conv-a");
        coordinator.onViewportResize(1024);

        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.getType()).isEqualTo(StateChangeType.VIEW_MODE_CHANGED);
            assertThat(event.getConversationId()).isEqualTo("conv-a");
        });
    }
}
