/**
 * Database access package: pool creation and reachability check for a job run.
 */
package io.github.yok.tablemailer.db;
