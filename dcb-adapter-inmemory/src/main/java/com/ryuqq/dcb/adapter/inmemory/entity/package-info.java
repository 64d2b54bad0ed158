/**
 * In-memory entity repository adapter.
 *
 * @author DCB Team
 * @since 1.0.0
 */
package com.ryuqq.dcb.adapter.inmemory.entity;
