package com.danieljhkim.meshcoord.meshcoordinator;

import com.danieljhkim.meshcoord.meshcommon.config.AppConfig;
import com.danieljhkim.meshcoord.meshcommon.config.ConfigLoader;
import com.danieljhkim.meshcoord.meshcommon.config.SystemConfig;
import com.danieljhkim.meshcoord.meshcoordinator.config.CoordinatorConfig;
import com.danieljhkim.meshcoord.meshcoordinator.model.HardwareFeatures;
import com.danieljhkim.meshcoord.meshcoordinator.model.LocalNode;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeCapabilities;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeId;
import com.danieljhkim.meshcoord.meshcoordinator.model.NodeLocation;
import com.danieljhkim.meshcoord.meshcoordinator.model.ResourceType;
import com.danieljhkim.meshcoord.meshcoordinator.service.MeshCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of a coordinator node. Loads {@code mesh-config.yml}, joins the mesh with the configured local
 * node and runs until the JVM is asked to stop.
 *
 * <p>
 * Args: [configPath]. The path can also come from {@code mesh.config.path} or {@code MESH_CONFIG_PATH}.
 */
public class MeshCoordinatorApplication {

    private static final Logger logger = LoggerFactory.getLogger(MeshCoordinatorApplication.class);
    private static final SystemConfig CONFIG = SystemConfig.getInstance("coordinator");

    public static void main(String[] args) throws IOException, InterruptedException {
        logger.info("Starting mesh coordinator...");

        String configPath = CONFIG.getProperty("config.path", ConfigLoader.getConfigFilePath());
        if (args.length > 0) {
            configPath = args[0];
            logger.info("Config path overridden from args: {}", configPath);
        }

        AppConfig appConfig = ConfigLoader.load(configPath);
        CoordinatorConfig coordinatorConfig = CoordinatorConfig.fromAppConfig(appConfig);
        logger.info("Loaded {}", coordinatorConfig);

        MeshCoordinator coordinator = MeshCoordinator.create(coordinatorConfig);
        coordinator.initialize(toLocalNode(appConfig.getLocalNode()));

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down mesh coordinator...");
            try {
                coordinator.leaveNetwork();
            } catch (RuntimeException e) {
                logger.error("Error while leaving the mesh", e);
            } finally {
                coordinator.shutdown();
                stopped.countDown();
            }
        }));

        coordinator.joinNetwork();
        logger.info("Mesh coordinator running");
        stopped.await();
    }

    static LocalNode toLocalNode(AppConfig.LocalNodeConfig node) {
        String address = node.getHost() + ":" + node.getPort();
        NodeId nodeId = NodeId.fromName(node.getName(), address);
        NodeCapabilities capabilities = new NodeCapabilities(
                node.getCpuCores(),
                node.getMemoryBytes(),
                node.getGpuDevices(),
                node.getStorageBytes(),
                node.getBandwidthMbps(),
                parseResourceTypes(node.getSupportedResources()),
                HardwareFeatures.none(),
                node.getSoftwareCapabilities());
        NodeLocation location =
                new NodeLocation(node.getDatacenter(), node.getRegion(), "", 0.0, 0.0, node.getZone());
        return new LocalNode(nodeId, capabilities, location);
    }

    static Set<ResourceType> parseResourceTypes(Iterable<String> names) {
        Set<ResourceType> types = EnumSet.noneOf(ResourceType.class);
        if (names != null) {
            for (String name : names) {
                types.add(ResourceType.parse(name));
            }
        }
        return types;
    }
}
