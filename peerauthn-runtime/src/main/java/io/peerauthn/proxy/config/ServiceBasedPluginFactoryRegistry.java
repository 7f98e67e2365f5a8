/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.peerauthn.proxy.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.peerauthn.proxy.plugin.Plugin;
import io.peerauthn.proxy.plugin.UnknownPluginInstanceException;

/**
 * A {@link PluginFactoryRegistry} that discovers plugin implementations using {@link ServiceLoader}.
 * Implementations must be annotated with {@link Plugin @Plugin}; they can be referenced by their fully qualified
 * class name, or by their simple class name when no other implementation of the same interface shares it.
 */
public class ServiceBasedPluginFactoryRegistry implements PluginFactoryRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceBasedPluginFactoryRegistry.class);

    record ProviderAndConfigType(ServiceLoader.Provider<?> provider,
                                 Class<?> config) {
        ProviderAndConfigType {
            Objects.requireNonNull(provider);
            Objects.requireNonNull(config);
        }
    }

    private final Map<Class<?>, Map<String, ProviderAndConfigType>> pluginInterfaceToNameToProvider = new ConcurrentHashMap<>();

    Map<String, ProviderAndConfigType> load(Class<?> pluginInterface) {
        Objects.requireNonNull(pluginInterface);
        return pluginInterfaceToNameToProvider.computeIfAbsent(pluginInterface,
                ServiceBasedPluginFactoryRegistry::loadProviders);
    }

    private static Map<String, ProviderAndConfigType> loadProviders(Class<?> pluginInterface) {
        Map<String, Set<ProviderAndConfigType>> nameToProviders = new HashMap<>();
        ServiceLoader.load(pluginInterface).stream().forEach(provider -> {
            Class<?> providerType = provider.type();
            Plugin annotation = providerType.getAnnotation(Plugin.class);
            if (annotation == null) {
                LOGGER.warn("Ignoring provider {} of service {} because it is not annotated with @{}",
                        providerType.getName(), pluginInterface.getName(), Plugin.class.getSimpleName());
                return;
            }
            ProviderAndConfigType providerAndConfigType = new ProviderAndConfigType(provider, annotation.configType());
            Stream.of(providerType.getName(), providerType.getSimpleName())
                    .forEach(name -> nameToProviders.computeIfAbsent(name, k -> new LinkedHashSet<>()).add(providerAndConfigType));
        });
        Map<String, ProviderAndConfigType> unambiguous = new HashMap<>();
        nameToProviders.forEach((name, providers) -> {
            if (providers.size() == 1) {
                unambiguous.put(name, providers.iterator().next());
            }
            else {
                LOGGER.warn("'{}' would be an ambiguous reference to a {} provider. "
                        + "It could refer to any of {}, so the fully qualified names must be used",
                        name,
                        pluginInterface.getSimpleName(),
                        providers.stream().map(p -> p.provider().type().getName()).collect(Collectors.joining(", ")));
            }
        });
        return Collections.unmodifiableMap(unambiguous);
    }

    @Override
    public <P> PluginFactory<P> pluginFactory(Class<P> pluginClass) {
        var nameToProvider = load(pluginClass);
        return new PluginFactory<>() {
            @Override
            public P pluginInstance(String instanceName) {
                return pluginClass.cast(lookup(instanceName).provider().get());
            }

            @Override
            public Class<?> configType(String instanceName) {
                return lookup(instanceName).config();
            }

            @Override
            public Set<String> registeredInstanceNames() {
                return nameToProvider.keySet();
            }

            private ProviderAndConfigType lookup(String instanceName) {
                if (Objects.requireNonNull(instanceName).isEmpty()) {
                    throw new IllegalArgumentException("A plugin instance name must not be empty");
                }
                var provider = nameToProvider.get(instanceName);
                if (provider == null) {
                    throw new UnknownPluginInstanceException("Unknown " + pluginClass.getName() + " plugin instance for name '" + instanceName + "'. "
                            + "Known plugin instances are " + nameToProvider.keySet().stream().sorted().toList() + ". "
                            + "Plugins must be loadable by java.util.ServiceLoader and annotated with @" + Plugin.class.getSimpleName() + ".");
                }
                return provider;
            }
        };
    }
}
