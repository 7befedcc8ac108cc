/**
 * Small shared helpers: error reporting and log masking.
 */
package io.github.yok.tablemailer.util;
