package com.example.messaging.chat.service;

import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.dto.ViewState;
import com.example.messaging.shared.exception.InvalidInputException;
import com.example.messaging.shared.util.Constants.LayoutMode;
import com.example.messaging.shared.util.Constants.StateChangeType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.UnaryOperator;

/**
 * List/detail state machine over the selected conversation and the layout mode.
 * <pre>
 *   DESKTOP      --viewport &lt; breakpoint--&gt; MOBILE_LIST (selection kept, chat hidden)
 *   MOBILE_LIST  --select(id)-------------&gt; MOBILE_CHAT
 *   MOBILE_CHAT  --back-------------------&gt; MOBILE_LIST (selection cleared)
 *   MOBILE_*     --viewport &gt;= breakpoint-&gt; DESKTOP (selection kept)
 * </pre>
 * This is the only owner of the selection.
 */
@Component
@Slf4j
public class ViewCoordinator {

    private final StateChangePublisher stateChangePublisher;
    private final int mobileBreakpoint;

    // guarded by this
    private ViewState state = ViewState.initial();

    public ViewCoordinator(StateChangePublisher stateChangePublisher, AppProperties appProperties) {
        this.stateChangePublisher = stateChangePublisher;
        this.mobileBreakpoint = appProperties.getView().getMobileBreakpoint();
    }

    public synchronized ViewState currentState() {
        return state;
    }

    /**
     * True when the conversation is selected and its chat pane is on screen.
     */
    public synchronized boolean isViewing(String conversationId) {
        return conversationId != null
                && conversationId.equals(state.getSelectedConversationId())
                && state.isChatVisible();
    }

    public ViewState selectConversation(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new InvalidInputException("Conversation id must not be empty");
        }
        return transition("select", current -> {
            LayoutMode next = current.getLayoutMode() == LayoutMode.DESKTOP ? LayoutMode.DESKTOP : LayoutMode.MOBILE_CHAT;
            return new ViewState(conversationId, next);
        });
    }

    public ViewState goBack() {
        return transition("back", current -> current.getLayoutMode() == LayoutMode.MOBILE_CHAT
                ? new ViewState(null, LayoutMode.MOBILE_LIST)
                : current);
    }

    public ViewState onViewportResize(int width) {
        if (width <= 0) {
            throw new InvalidInputException("Viewport width must be positive, got " + width);
        }
        boolean mobile = width < mobileBreakpoint;
        return transition("resize", current -> {
            LayoutMode mode = current.getLayoutMode();
            if (mobile && mode == LayoutMode.DESKTOP) {
                return current.withLayoutMode(LayoutMode.MOBILE_LIST);
            }
            if (!mobile && mode != LayoutMode.DESKTOP) {
                return current.withLayoutMode(LayoutMode.DESKTOP);
            }
            return current;
        });
    }

    private ViewState transition(String trigger, UnaryOperator<ViewState> step) {
        ViewState before;
        ViewState after;
        synchronized (this) {
            before = state;
            after = step.apply(before);
            state = after;
        }
        if (!after.equals(before)) {
            log.debug("View {}: {} -> {}", trigger, before, after);
            stateChangePublisher.publish(StateChangeType.VIEW_MODE_CHANGED, after.getSelectedConversationId(), null);
        }
        return after;
    }
}
