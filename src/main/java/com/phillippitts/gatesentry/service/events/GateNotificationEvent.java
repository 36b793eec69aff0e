package com.phillippitts.gatesentry.service.events;

/**
 * Spring application event wrapping a {@link GateEvent} that has been dispatched by the event loop.
 *
 * @param event dispatched gate event
 */
public record GateNotificationEvent(GateEvent event) {
}
