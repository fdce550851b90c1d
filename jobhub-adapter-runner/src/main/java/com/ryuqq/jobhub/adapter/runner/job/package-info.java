/**
 * Job status reporting for background agents.
 *
 * @since 1.0.0
 * @author JobHub Team
 */
package com.ryuqq.jobhub.adapter.runner.job;
