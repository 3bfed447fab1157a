/**
 * In-memory SessionManager.
 *
 * @since 1.0.0
 */
package com.ryuqq.unifiedstate.adapter.inmemory.session;
