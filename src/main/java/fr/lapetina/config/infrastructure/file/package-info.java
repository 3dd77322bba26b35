/**
 * File based configuration providers and file watching.
 *
 * <h2>Formats</h2>
 * <ul>
 *   <li>{@link fr.lapetina.config.infrastructure.file.JsonConfigurationProvider} - JSON, parsed with Jackson</li>
 *   <li>{@link fr.lapetina.config.infrastructure.file.YamlConfigurationProvider} - YAML, parsed with SnakeYAML</li>
 *   <li>{@link fr.lapetina.config.infrastructure.file.IniConfigurationProvider} - INI sections and keys</li>
 *   <li>{@link fr.lapetina.config.infrastructure.file.XmlConfigurationProvider} - XML elements and attributes</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>A {@link fr.lapetina.config.infrastructure.file.FileSource} marked as reloadable is watched
 * by a {@link fr.lapetina.config.infrastructure.file.FileChangeWatcher}. When the file changes,
 * the provider reads it again and fires its reload token.
 */
package fr.lapetina.config.infrastructure.file;
