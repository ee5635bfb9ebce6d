package io.surfworks.meshforge.codegen.rule;

import io.surfworks.meshforge.codegen.EmissionException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps operation signatures to the rules that render them.
 *
 * <p>Populated once at startup and read concurrently afterwards. There is no
 * default rule: looking up an unregistered signature is an error.
 */
public final class EmitRuleRegistry {

    private final Map<String, EmitRule> rules = new ConcurrentHashMap<>();

    /**
     * Register a rule for a signature, replacing any previous one.
     *
     * @param signature operation signature (e.g. "torch.add")
     * @param rule      rule rendering that signature
     * @return this registry
     */
    public EmitRuleRegistry register(String signature, EmitRule rule) {
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("signature cannot be blank");
        }
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null for " + signature);
        }
        rules.put(signature, rule);
        return this;
    }

    /**
     * Register the same rule for several signatures.
     */
    public EmitRuleRegistry registerAll(Collection<String> signatures, EmitRule rule) {
        for (String signature : signatures) {
            register(signature, rule);
        }
        return this;
    }

    /**
     * Remove the rule of a signature.
     */
    public void unregister(String signature) {
        rules.remove(signature);
    }

    public boolean isRegistered(String signature) {
        return rules.containsKey(signature);
    }

    /**
     * Registered signatures, sorted.
     */
    public List<String> signatures() {
        return rules.keySet().stream().sorted().toList();
    }

    /**
     * Rule for a signature.
     *
     * @throws EmissionException with {@code MISSING_RULE} if none is registered
     */
    public EmitRule lookup(String signature) {
        EmitRule rule = rules.get(signature);
        if (rule == null) {
            throw new EmissionException(
                "No emit rule registered for signature '" + signature + "'",
                EmissionException.ErrorCode.MISSING_RULE);
        }
        return rule;
    }
}
