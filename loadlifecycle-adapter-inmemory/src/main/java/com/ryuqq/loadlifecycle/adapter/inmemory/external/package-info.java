/**
 * In-memory stand-ins for external collaborators (ledger, outbound delivery, HOS, approvals).
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.adapter.inmemory.external;
