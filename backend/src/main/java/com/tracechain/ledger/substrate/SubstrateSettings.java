package com.tracechain.ledger.substrate;

import java.time.Duration;

/**
 * Pallet coordinates and submission behaviour for {@link SubstrateLedgerClient}.
 *
 * @param palletName                storage prefix of the logistics pallet
 * @param palletIndex               call index of the pallet in the runtime
 * @param registerShipmentCallIndex call index of register_shipment within the pallet
 * @param registerEventCallIndex    call index of register_event within the pallet
 * @param registerDocumentCallIndex call index of register_document within the pallet
 * @param metadataHashExtension     runtime includes the CheckMetadataHash signed extension
 * @param ss58Prefix                address format of the network
 * @param waitForInclusion          block register calls until the extrinsic is in a block
 * @param inclusionTimeout          give up waiting after this long
 * @param blockPollInterval         delay between head polls while waiting
 * @param statusScanDepth           number of recent blocks searched for a transaction's status
 * @param documentScanPageSize      keys per state_getKeysPaged request during document lookup
 * @param documentScanMaxKeys       upper bound of document keys read during a lookup
 */
public record SubstrateSettings(
        String palletName,
        int palletIndex,
        int registerShipmentCallIndex,
        int registerEventCallIndex,
        int registerDocumentCallIndex,
        boolean metadataHashExtension,
        int ss58Prefix,
        boolean waitForInclusion,
        Duration inclusionTimeout,
        Duration blockPollInterval,
        int statusScanDepth,
        int documentScanPageSize,
        int documentScanMaxKeys
) {
}
