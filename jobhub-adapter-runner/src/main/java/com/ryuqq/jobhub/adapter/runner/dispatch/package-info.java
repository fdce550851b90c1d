/**
 * Registry-backed broadcast dispatcher.
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner.dispatch;
