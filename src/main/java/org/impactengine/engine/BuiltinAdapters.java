package org.impactengine.engine;

import org.impactengine.metrics.file.FileMetricsAdapter;
import org.impactengine.metrics.simulator.SimulatorMetricsAdapter;
import org.impactengine.models.approximation.MetricsApproximationAdapter;
import org.impactengine.models.subclassification.SubclassificationAdapter;
import org.impactengine.storage.FileSystemStorageAdapter;
import org.impactengine.transforms.AggregateByDateTransform;
import org.impactengine.transforms.AggregateForApproximationTransform;
import org.impactengine.transforms.PassthroughTransform;

/**
 * Registers every adapter shipped with the engine. Adding a built-in adapter means adding
 * one line here.
 */
final class BuiltinAdapters {

    private BuiltinAdapters() {
    }

    static void registerAll(AdapterRegistries registries) {
        registries.metrics().register("file", FileMetricsAdapter.class);
        registries.metrics().register("simulator", SimulatorMetricsAdapter.class);

        registries.models().register(SubclassificationAdapter.MODEL_TYPE, SubclassificationAdapter.class);
        registries.models().register(MetricsApproximationAdapter.MODEL_TYPE, MetricsApproximationAdapter.class);

        registries.storage().register("filesystem", FileSystemStorageAdapter.class);

        registries.transforms().register("passthrough", PassthroughTransform.class);
        registries.transforms().register("aggregate_by_date", AggregateByDateTransform.class);
        registries.transforms().register("aggregate_for_approximation", AggregateForApproximationTransform.class);
    }
}
