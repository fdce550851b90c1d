/**
 * Contract test infrastructure.
 *
 * <p>{@link com.ryuqq.jobhub.testkit.contract.AbstractContractTest} wires the runner adapters
 * over {@link com.ryuqq.jobhub.testkit.contract.RecordingChannel} connections and a
 * {@link com.ryuqq.jobhub.testkit.time.VirtualTime} clock. The contract tests in this
 * module's test sources extend it.</p>
 */
package com.ryuqq.jobhub.testkit.contract;
