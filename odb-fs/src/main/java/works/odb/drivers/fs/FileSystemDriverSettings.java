package works.odb.drivers.fs;

import java.nio.file.Path;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.odb.OdbProperties;

@Value
@Builder(toBuilder = true)
public class FileSystemDriverSettings {
	public static final String BASE_DIR = "fs.baseDir";
	public static final String PRETTY_PRINT = "fs.prettyPrint";

	/**
	 * Directory under which each collection gets a subdirectory.
	 */
	@Default Path baseDir = Path.of("fs_data");

	/**
	 * If true, documents are kept in a {@code test_data} subdirectory of {@link #baseDir},
	 * which is deleted when the driver is closed.
	 */
	@Default boolean test = false;

	/**
	 * Indent the JSON files so they're easier to read.
	 */
	@Default boolean prettyPrint = true;

	/**
	 * Reads {@value #BASE_DIR} and {@value #PRETTY_PRINT} from the settings,
	 * and test mode from {@link OdbProperties#test()}.
	 */
	public static FileSystemDriverSettings from(OdbProperties props) {
		FileSystemDriverSettingsBuilder builder = FileSystemDriverSettings.builder()
			.test(props.test());
		props.setting(BASE_DIR).ifPresent(dir -> builder.baseDir(Path.of(dir)));
		props.setting(PRETTY_PRINT).ifPresent(p -> builder.prettyPrint(Boolean.parseBoolean(p)));
		return builder.build();
	}

	/**
	 * @return the directory actually holding the collections
	 */
	public Path rootDir() {
		return test ? baseDir.resolve(FileSystemDriver.TEST_DIR) : baseDir;
	}
}
