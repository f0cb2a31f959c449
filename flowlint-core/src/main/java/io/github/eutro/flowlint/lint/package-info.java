/**
 * Registering rules, running them, and collecting what they report.
 */
package io.github.eutro.flowlint.lint;
