/**
 * JSON rendering of the audit record layout.
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.adapter.inmemory.codec;
