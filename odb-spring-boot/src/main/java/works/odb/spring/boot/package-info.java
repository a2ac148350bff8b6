/**
 * Spring Boot auto-configuration for an {@link works.odb.Odb} bean.
 */
package works.odb.spring.boot;
