/**
 * Reflection based binding of configuration sections to Java types.
 *
 * <h2>Supported Targets</h2>
 * <ul>
 *   <li>Scalars known to {@link fr.lapetina.config.binder.ValueParsers}, including enums</li>
 *   <li>Arrays, lists, sets and queues</li>
 *   <li>Maps, with keys encoded by {@link fr.lapetina.config.binder.MapKeyCodec}</li>
 *   <li>Records and classes with a no-argument constructor</li>
 *   <li>{@code Optional} of any of the above</li>
 * </ul>
 *
 * @see fr.lapetina.config.binder.ConfigurationBinder
 */
package fr.lapetina.config.binder;
