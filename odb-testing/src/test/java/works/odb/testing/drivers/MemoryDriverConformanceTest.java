package works.odb.testing.drivers;

import works.odb.DriverEntry;
import works.odb.drivers.MemoryDriver;

class MemoryDriverConformanceTest extends DriverConformanceTest {
	@Override
	protected DriverEntry driverEntry() {
		return MemoryDriver.entry();
	}
}
