package org.evmkit.compiler.backend.link;

import java.util.ArrayList;
import java.util.List;

import org.evmkit.compiler.backend.link.features.JumpDestLinkingRule;
import org.evmkit.compiler.backend.link.features.JumpPointerLinkingRule;
import org.evmkit.compiler.backend.link.features.SelfCodeSizeLinkingRule;

/**
 * Registry for linking rules, which are applied in order to each token.
 */
public class LinkingRegistry {

    private final List<ILinkingRule> rules = new ArrayList<>();

    /**
     * Registers a new linking rule.
     * @param rule The rule to register.
     */
    public void register(ILinkingRule rule) { rules.add(rule); }

    /**
     * @return The list of registered linking rules.
     */
    public List<ILinkingRule> rules() { return rules; }

    /**
     * Initializes a new linking registry with the default rules.
     * @return A new registry with default rules.
     */
    public static LinkingRegistry initializeWithDefaults() {
        LinkingRegistry reg = new LinkingRegistry();
        reg.register(new JumpPointerLinkingRule());
        reg.register(new JumpDestLinkingRule());
        reg.register(new SelfCodeSizeLinkingRule());
        return reg;
    }
}
