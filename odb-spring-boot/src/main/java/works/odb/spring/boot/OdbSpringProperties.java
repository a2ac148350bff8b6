package works.odb.spring.boot;

import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import works.odb.Environment;
import works.odb.OdbProperties;

/**
 * Binds {@code odb.*}. Driver settings have dotted names, so give them in
 * bracket notation to keep them intact, as in {@code odb.settings[fs.baseDir]=/var/odb}.
 */
@ConfigurationProperties(prefix = "odb")
public record OdbSpringProperties(
	String name,
	Boolean test,
	Environment environment,
	Set<String> drivers,
	Map<String, String> settings
) {
	public String nameOrDefault() {
		return name == null ? "odb" : name;
	}

	public OdbProperties toOdbProperties() {
		OdbProperties.OdbPropertiesBuilder builder = OdbProperties.builder();
		if (test != null) {
			builder.test(test);
		}
		if (environment != null) {
			builder.environment(environment);
		}
		if (drivers != null) {
			builder.drivers(drivers);
		}
		if (settings != null) {
			builder.settings(settings);
		}
		return builder.build();
	}
}
