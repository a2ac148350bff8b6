package works.odb.testing.drivers;

import works.odb.DriverEntry;
import works.odb.Environment;
import works.odb.drivers.ForwardingDriver;
import works.odb.drivers.MemoryDriver;

/**
 * A {@link ForwardingDriver} should be indistinguishable from the driver it wraps.
 */
class ForwardingDriverConformanceTest extends DriverConformanceTest {
	@Override
	protected DriverEntry driverEntry() {
		return new DriverEntry("forwarding", Environment.CLIENT, props -> new ForwardingDriver(new MemoryDriver()));
	}
}
