package org.Aayush.wayfinder.transit;

import lombok.experimental.UtilityClass;

/**
 * Bundled networks.
 */
@UtilityClass
public class TransitNetworks {

    /**
     * Ten-station city network with fifteen directed connections, times in minutes.
     */
    public TransitNetwork reference() {
        return TransitNetwork.builder()
                .stations(
                        "Centro", "Rodoviaria", "Shopping", "Parque", "Hospital",
                        "Aeroporto", "Praia", "Bairro Norte", "Bairro Sul", "Terminal Central"
                )
                .connection("Centro", "Rodoviaria", 10)
                .connection("Centro", "Shopping", 15)
                .connection("Rodoviaria", "Centro", 12)
                .connection("Rodoviaria", "Parque", 20)
                .connection("Shopping", "Hospital", 8)
                .connection("Parque", "Aeroporto", 25)
                .connection("Hospital", "Rodoviaria", 7)
                .connection("Hospital", "Praia", 18)
                .connection("Aeroporto", "Terminal Central", 30)
                .connection("Praia", "Terminal Central", 22)
                .connection("Bairro Norte", "Centro", 5)
                .connection("Bairro Sul", "Centro", 8)
                .connection("Terminal Central", "Aeroporto", 28)
                .connection("Terminal Central", "Praia", 20)
                .connection("Parque", "Bairro Sul", 10)
                .build();
    }
}
