/**
 * Event tagging types.
 *
 * <p>Deciders emit minimal {@code DeciderEvent}s. The execution engine turns each into an
 * {@link com.ryuqq.dcb.core.event.EventData} carrying an event id, stream identity, bounded
 * context, schema version, {@link com.ryuqq.dcb.core.event.EventCategory} and correlation
 * metadata.</p>
 *
 * @since 1.0.0
 * @author DCB Team
 */
package com.ryuqq.dcb.core.event;
