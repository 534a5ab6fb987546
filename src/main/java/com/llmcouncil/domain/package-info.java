/**
 * Immutable domain model of a council deliberation.
 *
 * <p>All types are records. Collections are defensively copied in compact constructors, so a
 * value handed across a stage boundary can never be mutated by the next stage.
 */
package com.llmcouncil.domain;
