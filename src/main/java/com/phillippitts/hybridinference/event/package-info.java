/**
 * Event model and the dual-destination router.
 *
 * <p>Every event kind is a record implementing {@link com.phillippitts.hybridinference.event.SdkEvent}.
 * The {@link com.phillippitts.hybridinference.event.EventRouter} is the only dispatch point: it reads the
 * event's destination tag and fans it out to live subscribers, the telemetry sink, or both.
 */
package com.phillippitts.hybridinference.event;
