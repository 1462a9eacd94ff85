/**
 * Internal utilities.
 */
package workerkit.util;
