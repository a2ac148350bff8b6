package works.odb.spring.boot;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import works.odb.DriverEntry;
import works.odb.Odb;
import works.odb.Query;
import works.odb.Schema;
import works.odb.drivers.MemoryDriver;
import works.odb.drivers.fs.FileSystemDriver;
import works.odb.state.ObservedObject;

import static org.assertj.core.api.Assertions.assertThat;

class OdbAutoConfigurationTest {
	private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
		.withConfiguration(AutoConfigurations.of(OdbAutoConfiguration.class));

	@TempDir
	Path baseDir;

	@Test
	void noDrivers_usesMemoryDriver() {
		contextRunner
			.withPropertyValues("odb.test=true", "odb.name=springTest")
			.run(context -> {
				assertThat(context).hasSingleBean(Odb.class);
				Odb odb = context.getBean(Odb.class);
				assertThat(odb.context().name()).isEqualTo("springTest");
				assertThat(odb.context().registry().registeredNames()).containsExactly(MemoryDriver.NAME);

				ObservedObject value = ObservedObject.of(Map.of("name", "alice"));
				assertThat(odb.open(MemoryDriver.NAME, "users", value)).isPresent();
				assertThat(odb.open(MemoryDriver.NAME, "users", Query.of("name", "alice"))).isPresent();
			});
	}

	@Test
	void memoryDriver_notInitializedOnServer() {
		contextRunner
			.run(context -> {
				Odb odb = context.getBean(Odb.class);
				assertThat(odb.context().registry().registeredNames()).isEmpty();
			});
	}

	@Test
	void clientEnvironment_initializesMemoryDriver() {
		contextRunner
			.withPropertyValues("odb.environment=client")
			.run(context -> assertThat(context.getBean(Odb.class).context().registry().isRegistered(MemoryDriver.NAME)).isTrue());
	}

	@Test
	void schemaRegistrations_areEnforced() {
		contextRunner
			.withPropertyValues("odb.test=true")
			.withUserConfiguration(SchemaConfiguration.class)
			.run(context -> {
				Odb odb = context.getBean(Odb.class);
				assertThat(odb.validator().hasSchema("users")).isTrue();
				assertThat(odb.open(MemoryDriver.NAME, "users", ObservedObject.of(Map.of("name", 42)))).isEmpty();
				assertThat(odb.open(MemoryDriver.NAME, "users", ObservedObject.of(Map.of("name", "bob")))).isPresent();
			});
	}

	@Test
	void driverEntryBeans_replaceMemoryDriver() {
		contextRunner
			.withPropertyValues(
				"odb.test=true",
				"odb.drivers=fs",
				"odb.settings[fs.baseDir]=" + baseDir)
			.withUserConfiguration(FileSystemConfiguration.class)
			.run(context -> {
				Odb odb = context.getBean(Odb.class);
				assertThat(odb.context().registry().registeredNames()).containsExactly(FileSystemDriver.NAME);
				FileSystemDriver driver = (FileSystemDriver) odb.context().registry().driver(FileSystemDriver.NAME);
				assertThat(driver.rootDir()).isEqualTo(baseDir.resolve(FileSystemDriver.TEST_DIR).toAbsolutePath().normalize());
				assertThat(odb.open(FileSystemDriver.NAME, "notes", ObservedObject.of(Map.of("text", "hi")))).isPresent();
			});
	}

	@Test
	void closingContext_closesOdb() {
		Odb[] odb = new Odb[1];
		contextRunner
			.withPropertyValues("odb.test=true")
			.run(context -> {
				odb[0] = context.getBean(Odb.class);
				assertThat(odb[0].context().watchers().isRunning()).isTrue();
			});
		assertThat(odb[0].context().watchers().isRunning()).isFalse();
		assertThat(odb[0].context().registry().registeredNames()).isEmpty();
	}

	@Configuration
	static class SchemaConfiguration {
		@Bean
		SchemaRegistration usersSchema() {
			return new SchemaRegistration("users", Schema.builder()
				.field("name", v -> v instanceof String, "name must be a string")
				.build());
		}
	}

	@Configuration
	static class FileSystemConfiguration {
		@Bean
		DriverEntry fileSystemDriverEntry() {
			return FileSystemDriver.entry();
		}
	}
}
