package it.unimib.datai.clout.controlplane.registry;

import it.unimib.datai.clout.common.model.FunctionRegistration;

public interface FunctionRegistrationListener {

    void onRegister(FunctionRegistration registration);

    /**
     * Called after the trigger of a registration was set, replaced or cleared.
     */
    void onTriggerChanged(FunctionRegistration registration);

    void onRemove(String functionId);
}
