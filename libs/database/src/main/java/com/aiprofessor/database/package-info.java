/**
 * Database access for the AI Professor platform.
 *
 * <p>Every school (tenant) owns a MongoDB database; a central database holds the tenant registry,
 * audit logs, simulation sessions and migration bookkeeping.
 *
 * <ul>
 *   <li>{@link com.aiprofessor.database.tenant} opens and caches one connection per tenant database
 *   <li>{@link com.aiprofessor.database.migration} runs ordered, tracked migrations against the
 *       central database and against individual tenant databases
 * </ul>
 */
package com.aiprofessor.database;
