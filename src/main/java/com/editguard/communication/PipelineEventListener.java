package com.editguard.communication;

import com.editguard.core.event.Event;

/** Receives every published pipeline event on the publishing thread. */
public interface PipelineEventListener {

    void onEvent(Event event);
}
