/**
 * Simulation domain: sessions, the rules for starting and ending them, and the ports they depend
 * on.
 *
 * <ul>
 *   <li>Domain does not depend on the {@code api} or {@code infrastructure} packages
 *   <li>{@code port} holds the interfaces implemented by persistence adapters
 *   <li>{@code error} holds the exceptions mapped to HTTP problems by the web layer
 *   <li>{@code tenant} decides which school a staff member acts in
 *   <li>{@code audit} writes activity log entries
 * </ul>
 */
package com.aiprofessor.simulation.domain;
