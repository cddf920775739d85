/*
 * Copyright Promfed Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.promfed.proxy.discovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import io.promfed.proxy.config.ConfigException;
import io.promfed.proxy.config.GroupConfig;
import io.promfed.proxy.config.StaticTargetsConfig;
import io.promfed.proxy.model.LabelSet;

/**
 * Delivers the {@code static_configs} of a group, once, under the job {@value #JOB_NAME}.
 */
public class StaticDiscovery implements TargetDiscovery {

    public static final String JOB_NAME = "static";

    @Override
    public DiscoverySubscription subscribe(GroupConfig config, Consumer<Map<String, List<TargetGroup>>> updates) throws ConfigException {
        var groups = new ArrayList<TargetGroup>();
        List<StaticTargetsConfig> staticConfigs = config.staticConfigs();
        for (int i = 0; i < staticConfigs.size(); i++) {
            StaticTargetsConfig staticConfig = staticConfigs.get(i);
            var targets = new ArrayList<LabelSet>();
            for (String address : staticConfig.targets()) {
                if (address == null || address.isBlank()) {
                    throw new ConfigException("server group '" + config.name() + "': static target address must not be empty");
                }
                targets.add(LabelSet.of(LabelSet.ADDRESS_LABEL, address.trim()));
            }
            groups.add(new TargetGroup(Integer.toString(i), targets, LabelSet.of(staticConfig.labels())));
        }
        updates.accept(Map.of(JOB_NAME, List.copyOf(groups)));
        return () -> {
            // nothing is delivered after subscribing
        };
    }
}
