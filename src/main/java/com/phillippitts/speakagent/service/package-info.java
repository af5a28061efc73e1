/**
 * Service layer: the dialogue engine and the collaborators it orchestrates.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.dialogue} - step loop, normalisation, classification step, routing</li>
 *   <li>{@code service.classify} - intent classifiers (language model, rule based)</li>
 *   <li>{@code service.slots} - slot schema and missing/unresolved computation</li>
 *   <li>{@code service.resolve} - contact lookup and entity resolution</li>
 *   <li>{@code service.clarify} - clarification questions and budget</li>
 *   <li>{@code service.dispatch} / {@code service.skill} - skill registry and skills</li>
 *   <li>{@code service.compose} / {@code service.phrase} - reply phrasing</li>
 *   <li>{@code service.session} - session ownership and per-session serialisation</li>
 *   <li>{@code service.external} - time-bounded external calls</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Collaborators that may block sit behind interfaces and have deterministic test doubles</li>
 *   <li>Services use constructor injection (not field injection)</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 * </ul>
 */
package com.phillippitts.speakagent.service;
