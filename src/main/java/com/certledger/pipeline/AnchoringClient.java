package com.certledger.pipeline;

import com.certledger.models.AnchorReceipt;
import com.certledger.models.AnchorRequest;

import java.util.function.Consumer;

/**
 * External ledger anchoring. {@code anchor} must return without waiting for
 * finality; the receipt arrives later through {@code onReceipt}, possibly on
 * another thread.
 */
public interface AnchoringClient {

    void anchor(AnchorRequest request, Consumer<AnchorReceipt> onReceipt);
}
