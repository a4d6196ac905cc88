package org.brighted.store;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.brighted.store.api.IGameStateStore;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Creates the configured {@link IGameStateStore}.
 * <p>
 * The store block names the implementation and its options:
 * <pre>
 * store {
 *   className = "org.brighted.store.H2GameStateStore"
 *   options { jdbcUrl = "jdbc:h2:./data/brighted" }
 * }
 * </pre>
 * Implementations must provide a public {@code (String name, Config options)} constructor.
 */
public final class GameStateStoreFactory {

    private GameStateStoreFactory() {}

    /**
     * @param name   logical name of the store instance
     * @param config the store block, containing {@code className} and optional {@code options}
     * @return the created store
     * @throws IllegalArgumentException if the block is incomplete or the class is unusable
     */
    public static IGameStateStore create(String name, Config config) {
        if (!config.hasPath("className")) {
            throw new IllegalArgumentException("Store configuration is missing 'className' property.");
        }
        String className = config.getString("className");
        Config options = config.hasPath("options") ? config.getConfig("options") : ConfigFactory.empty();

        try {
            Class<?> storeClass = Class.forName(className);
            if (!IGameStateStore.class.isAssignableFrom(storeClass)) {
                throw new IllegalArgumentException(String.format("Class %s does not implement %s",
                        className, IGameStateStore.class.getName()));
            }
            Constructor<?> constructor = storeClass.getConstructor(String.class, Config.class);
            return (IGameStateStore) constructor.newInstance(name, options);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Store class not found: " + className, e);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("Store must have public constructor(String, Config): " + className, e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalArgumentException("Failed to create store '" + name + "' with class " + className, cause);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to create store '" + name + "' with class " + className, e);
        }
    }
}
