package org.neuralchilli.pressroom.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.MapConfig;
import com.hazelcast.config.QueueConfig;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import io.quarkus.runtime.Startup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.pressroom.core.TaskRecordStore;
import org.neuralchilli.pressroom.domain.TaskRecord;
import org.neuralchilli.pressroom.serializer.TaskRecordSerializer;
import org.neuralchilli.pressroom.worker.PipelineWorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configures and produces the embedded Hazelcast member that holds task
 * records and the work queue.
 */
@ApplicationScoped
public class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    @ConfigProperty(name = "pressroom.hazelcast.cluster-name", defaultValue = "pressroom-dev")
    String clusterName;

    @Inject
    PipelineConfig pipelineConfig;

    @Produces
    @Singleton
    @Startup
    public HazelcastInstance hazelcastInstance() {
        log.info("Initializing Hazelcast with cluster name: {}", clusterName);

        Config config = new Config();
        config.setClusterName(clusterName);
        config.setProperty("hazelcast.logging.type", "slf4j");
        config.setProperty("hazelcast.phone.home.enabled", "false");

        // Single embedded member, no discovery
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);

        SerializationConfig serializationConfig = config.getSerializationConfig();
        serializationConfig.setEnableCompression(false);
        serializationConfig.setEnableSharedObject(false);
        registerCustomSerializers(serializationConfig);

        // Records live in memory only; nothing to back up on a single member
        config.addMapConfig(new MapConfig(TaskRecordStore.MAP_NAME)
                .setBackupCount(0));

        int capacity = pipelineConfig.worker().queueCapacity();
        config.addQueueConfig(new QueueConfig(PipelineWorkerPool.QUEUE_NAME)
                .setMaxSize(capacity)
                .setBackupCount(0));

        HazelcastInstance instance = Hazelcast.newHazelcastInstance(config);

        log.info("Hazelcast instance created (queue capacity: {})", capacity);

        return instance;
    }

    void shutdown(@Disposes HazelcastInstance instance) {
        log.info("Shutting down Hazelcast instance");
        instance.shutdown();
    }

    private void registerCustomSerializers(SerializationConfig serializationConfig) {
        SerializerConfig taskRecordSerializerConfig = new SerializerConfig()
                .setTypeClass(TaskRecord.class)
                .setImplementation(new TaskRecordSerializer());
        serializationConfig.addSerializerConfig(taskRecordSerializerConfig);
        log.debug("Registered TaskRecordSerializer (TYPE_ID: {})", TaskRecordSerializer.TYPE_ID);
    }
}
