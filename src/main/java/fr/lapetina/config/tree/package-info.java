/**
 * The merged configuration tree.
 *
 * <p>A {@link fr.lapetina.config.tree.ConfigurationRoot} queries its providers from the
 * highest to the lowest priority. Sections are lightweight views addressing the root
 * with a path prefix; they hold no data of their own.
 *
 * <h2>Reloading</h2>
 * <ul>
 *   <li>Each provider exposes a single-use change token</li>
 *   <li>A fired provider token marks the root as changed</li>
 *   <li>The next reload picks up the change, then fires the root token</li>
 * </ul>
 *
 * <p>Automatic reloading on provider change is opt-in through
 * {@link fr.lapetina.config.ConfigurationBuilder#reloadOnChange(boolean)}.
 */
package fr.lapetina.config.tree;
