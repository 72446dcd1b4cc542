/**
 * Alert persistence and the delivery state machine.
 *
 * <p>
 * {@link com.moodsentinel.core.store.AlertStore} is the contract;
 * {@link com.moodsentinel.core.store.JdbcAlertStore} implements it over JDBC
 * with SQL kept in {@code sql/schema.sql} and {@code sql/queries.sql}.
 * </p>
 *
 * @since 1.0.0
 */
package com.moodsentinel.core.store;
