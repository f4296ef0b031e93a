/**
 * In-process broadcast hub.
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.adapter.inmemory.broadcast;
