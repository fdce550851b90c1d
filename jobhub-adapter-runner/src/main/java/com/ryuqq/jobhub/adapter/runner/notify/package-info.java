/**
 * Operator-initiated broadcasts: system and maintenance notices, optionally filtered by plan tier.
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner.notify;
