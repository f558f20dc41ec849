package de.t14d3.spindle.mapping;

import de.t14d3.spindle.annotations.Entity;
import de.t14d3.spindle.core.Record;
import de.t14d3.spindle.exceptions.SchemaException;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

public class EntityScanner {
    /**
     * Scans the classpath for all @Entity types under the given packages.
     * Requires 'org.reflections:reflections' on the classpath.
     */
    @SuppressWarnings("unchecked")
    public static List<Class<? extends Record>> scan(String... packages) {
        if (packages == null || packages.length == 0) {
            throw new IllegalArgumentException("at least one package is required");
        }
        ConfigurationBuilder configuration = new ConfigurationBuilder()
                .setScanners(Scanners.TypesAnnotated, Scanners.SubTypes);
        FilterBuilder filter = new FilterBuilder();
        for (String pkg : packages) {
            configuration.addUrls(ClasspathHelper.forPackage(pkg));
            filter.includePackage(pkg);
        }
        configuration.filterInputsBy(filter);

        Set<Class<?>> entities = new Reflections(configuration).getTypesAnnotatedWith(Entity.class);
        List<Class<? extends Record>> result = new ArrayList<>();
        for (Class<?> cls : entities) {
            if (!Record.class.isAssignableFrom(cls)) {
                throw new SchemaException("@Entity class " + cls.getName() + " does not implement Record");
            }
            result.add((Class<? extends Record>) cls);
        }
        // Reflections returns a hash set; keep registration deterministic.
        result.sort(Comparator.comparing(Class::getName));
        return result;
    }
}
