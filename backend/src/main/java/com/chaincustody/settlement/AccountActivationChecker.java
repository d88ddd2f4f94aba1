package com.chaincustody.settlement;

import com.chaincustody.domain.ChainDescriptor;

/**
 * For chains where sending to a fresh account costs an activation fee.
 */
public interface AccountActivationChecker {

    boolean supports(ChainDescriptor chain);

    boolean isActivated(ChainDescriptor chain, String address);
}
