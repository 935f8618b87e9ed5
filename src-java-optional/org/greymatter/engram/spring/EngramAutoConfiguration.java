package org.greymatter.engram.spring;

import org.greymatter.engram.EngramConfig;
import org.greymatter.engram.EngramMemory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for {@link EngramMemory}.
 *
 * <p>Activated when {@code engram.storage-path} is set. The bean is initialized
 * before it is handed out and saved when the context closes.
 */
@AutoConfiguration
@ConditionalOnClass(EngramMemory.class)
@EnableConfigurationProperties(EngramProperties.class)
public class EngramAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(EngramMemory.class)
    @ConditionalOnProperty(prefix = "engram", name = "storage-path")
    public EngramMemory engramMemory(EngramProperties props) {
        EngramMemory memory = new EngramMemory(toConfig(props));
        memory.initialize();
        return memory;
    }

    static EngramConfig toConfig(EngramProperties props) {
        EngramConfig.Builder builder = EngramConfig.builder()
            .storagePath(props.getStoragePath());

        if (props.getDimensions() != null && props.getDimensions() > 0) {
            builder.dimensions(props.getDimensions());
        }
        if (props.getQuantizer() != null) {
            builder.quantizer(props.getQuantizer());
        }
        if (props.getCodebookSize() != null) {
            builder.codebookSize(props.getCodebookSize());
        }
        if (props.getSimilarityThreshold() != null) {
            builder.similarityThreshold(props.getSimilarityThreshold());
        }
        if (props.getNeuronCountStrategy() != null) {
            builder.neuronCountStrategy(props.getNeuronCountStrategy());
        }
        if (props.getMinConceptNeurons() != null) {
            builder.minConceptNeurons(props.getMinConceptNeurons());
        }
        if (props.getMaxConceptNeurons() != null) {
            builder.maxConceptNeurons(props.getMaxConceptNeurons());
        }
        if (props.getPartitionCount() != null) {
            builder.partitionCount(props.getPartitionCount());
        }
        if (props.getMaxConcurrentWrites() != null) {
            builder.maxConcurrentWrites(props.getMaxConcurrentWrites());
        }
        if (props.getCompressBanks() != null) {
            builder.compressBanks(props.getCompressBanks());
        }
        if (props.getIdleUnload() != null) {
            builder.idleUnload(props.getIdleUnload());
        }

        return builder.build();
    }
}
