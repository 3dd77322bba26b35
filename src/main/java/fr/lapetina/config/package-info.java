/**
 * Layered configuration with change notification and typed binding.
 *
 * <h2>Architecture</h2>
 * <pre>
 * Sources ──► Providers ──► ConfigurationRoot ──► Sections / iteration ──► ConfigurationBinder
 *                 │                  ▲
 *                 └── reload tokens ─┘
 * </pre>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.config.ConfigurationBuilder} - Assembles sources in priority order</li>
 *   <li>{@link fr.lapetina.config.tree.ConfigurationRoot} - Merged view and reload protocol</li>
 *   <li>{@link fr.lapetina.config.domain.provider.ConfigurationProvider} - One source of key/value pairs</li>
 *   <li>{@link fr.lapetina.config.binder.ConfigurationBinder} - Rebuilds typed values from keys</li>
 * </ul>
 *
 * <h2>Keys</h2>
 * <p>Keys are {@code :}-separated paths compared without regard to case. A provider added
 * later overrides the values of the providers added before it.
 *
 * @see fr.lapetina.config.ConfigurationBuilder
 * @see fr.lapetina.config.ConfigurationInspectorApplication
 */
package fr.lapetina.config;
