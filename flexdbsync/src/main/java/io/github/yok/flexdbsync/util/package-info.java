/**
 * Small helpers shared across packages: connection opening, credential masking for logs, and fatal
 * error reporting.
 */
package io.github.yok.flexdbsync.util;
