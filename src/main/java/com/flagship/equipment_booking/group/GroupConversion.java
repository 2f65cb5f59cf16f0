package com.flagship.equipment_booking.group;

import com.flagship.equipment_booking.asset.Asset;
import lombok.Value;

/**
 * A group created from a single asset, and that asset as its first member.
 */
@Value(staticConstructor = "of")
public class GroupConversion {
    AssetGroup group;
    Asset asset;
}
