package com.example.gateway.authz.policy.casbin;

import com.example.gateway.authz.policy.DecisionPolicy;
import com.example.gateway.authz.policy.PolicyEvaluationException;
import lombok.extern.slf4j.Slf4j;
import org.casbin.jcasbin.main.Enforcer;
import org.casbin.jcasbin.model.Model;
import org.casbin.jcasbin.persist.file_adapter.FileAdapter;
import org.springframework.lang.NonNull;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Decision policy backed by a Casbin {@link Enforcer}.
 *
 * <p>The enforcer is loaded once from a model definition and a CSV policy and is read-only
 * afterwards, so concurrent {@code enforce} calls need no locking.
 */
@Slf4j
public class CasbinDecisionPolicy implements DecisionPolicy {

    private final Enforcer enforcer;

    public CasbinDecisionPolicy(@NonNull Enforcer enforcer) {
        this.enforcer = Objects.requireNonNull(enforcer, "enforcer");
    }

    /**
     * Build an enforcer from a model definition and a policy CSV.
     *
     * @throws IOException if the model cannot be read
     */
    public static CasbinDecisionPolicy load(@NonNull InputStream model, @NonNull InputStream policy)
            throws IOException {
        Model casbinModel = new Model();
        casbinModel.loadModelFromText(StreamUtils.copyToString(model, StandardCharsets.UTF_8));
        Enforcer enforcer = new Enforcer(casbinModel, new FileAdapter(policy));

        log.info("Casbin enforcer loaded with {} policy lines", enforcer.getPolicy().size());
        return new CasbinDecisionPolicy(enforcer);
    }

    @Override
    public boolean enforce(String subject, String object, String action) {
        try {
            return enforcer.enforce(subject, object, action);
        } catch (RuntimeException e) {
            throw new PolicyEvaluationException(
                    "Casbin could not evaluate " + action + " on " + object, e);
        }
    }
}
