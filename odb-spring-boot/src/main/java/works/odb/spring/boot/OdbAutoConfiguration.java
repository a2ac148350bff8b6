package works.odb.spring.boot;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import works.odb.DriverEntry;
import works.odb.Odb;
import works.odb.OdbContext;
import works.odb.drivers.MemoryDriver;

/**
 * Provides an initialized {@link Odb} built from every {@link DriverEntry} bean,
 * or just the {@link MemoryDriver} if there are none.
 * Every {@link SchemaRegistration} bean is registered with its validator.
 * <p>
 * The memory driver is a client driver, so outside test mode it's only
 * initialized when {@code odb.environment=client}.
 */
@AutoConfiguration
@EnableConfigurationProperties(OdbSpringProperties.class)
public class OdbAutoConfiguration {
	@Bean
	@ConditionalOnMissingBean(DriverEntry.class)
	DriverEntry memoryDriverEntry() {
		return MemoryDriver.entry();
	}

	@Bean(destroyMethod = "close")
	@ConditionalOnMissingBean
	Odb odb(
		OdbSpringProperties properties,
		ObjectProvider<DriverEntry> drivers,
		ObjectProvider<SchemaRegistration> schemas
	) {
		OdbContext context = OdbContext.builder()
			.name(properties.nameOrDefault())
			.drivers(drivers.orderedStream().toList())
			.build();
		Odb result = new Odb(context);
		schemas.orderedStream().forEach(s -> {
			LOGGER.debug("Registering schema for {}", s.collection());
			result.validator().register(s.collection(), s.schema());
		});
		Map<String, Boolean> initialized = result.init(properties.toOdbProperties());
		if (initialized.containsValue(false)) {
			LOGGER.warn("Some drivers are unavailable: {}", initialized);
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OdbAutoConfiguration.class);
}
