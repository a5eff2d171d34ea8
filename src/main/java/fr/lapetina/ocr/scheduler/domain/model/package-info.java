/**
 * Domain model for document-conversion jobs.
 *
 * <p>{@link fr.lapetina.ocr.scheduler.domain.model.Job} is the only mutable type; it
 * validates its own status transitions. Everything else here is an immutable value
 * or an enum with a lowercase wire name.
 */
package fr.lapetina.ocr.scheduler.domain.model;
