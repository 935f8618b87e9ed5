/**
 * Engram - embedded pattern-based associative memory.
 *
 * <h2>Overview</h2>
 * <p>Concepts are learned into clusters of integrate-and-fire neurons that live
 * in regions of a quantized feature space. Learning the same concept again
 * reuses and strengthens its cluster; free text is recognized by activating the
 * clusters of the concepts it mentions. All state persists under one directory
 * and clusters load lazily, so a memory can be far larger than the heap.</p>
 *
 * <h2>Key Features</h2>
 * <ul>
 *   <li><b>Cluster reuse</b> - a concept close to a known cluster joins it instead of duplicating it</li>
 *   <li><b>Adaptive capacity</b> - per-concept neuron targets, seeded by a hypernetwork and adjusted slowly</li>
 *   <li><b>Hebbian synapses</b> - co-firing neurons are linked in a sparse graph that is pruned and aged</li>
 *   <li><b>Partitioned storage</b> - neurons are stored in partition banks written atomically and in parallel</li>
 *   <li><b>Lazy loading</b> - clusters hydrate on first use and idle ones are evicted by {@code maintenance()}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * EngramConfig config = EngramConfig.builder()
 *     .storagePath("/data/engram")
 *     .quantizer(QuantizerType.CODEBOOK)
 *     .build();
 *
 * try (EngramMemory memory = new EngramMemory(config)) {
 *     memory.initialize();
 *
 *     memory.learnConcept("apple", Map.of("fruit", 1.0, "red", 0.8));
 *     memory.learnConcept("banana", Map.of("fruit", 1.0, "yellow", 0.9));
 *
 *     ProcessingResult r = memory.processInput("I ate an apple", Map.of());
 *     System.out.println(r.getResponse() + " (" + r.getConfidence() + ")");
 *
 *     double mastery = memory.getConceptMasteryLevel("apple");
 * }   // close() saves
 * }</pre>
 *
 * <h2>Framework Integration</h2>
 * <p>For Spring Boot, set {@code engram.storage-path}; see
 * {@link org.greymatter.engram.spring.EngramAutoConfiguration}.</p>
 *
 * <h2>Tuning</h2>
 * <ul>
 *   <li><b>similarityThreshold (0.85)</b>: Higher = fewer reused clusters, more duplicates.</li>
 *   <li><b>codebookSize (512)</b>: Number of regions for the codebook quantizer.</li>
 *   <li><b>min/maxConceptNeurons (50-600)</b>: Bounds of every concept's neuron target.</li>
 *   <li><b>partitionCount (16)</b>: Bank files; more partitions mean smaller rewrites on save.</li>
 * </ul>
 *
 * @see org.greymatter.engram.EngramMemory
 * @see org.greymatter.engram.EngramConfig
 * @see org.greymatter.engram.ProcessingResult
 */
package org.greymatter.engram;
