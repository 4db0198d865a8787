package com.clinicflow.api;

import com.clinicflow.inventory.InventoryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/inventory")
public class InventoryController {

    private final InventoryService inventoryService;

    public InventoryController(InventoryService inventoryService) {
        this.inventoryService = inventoryService;
    }

    @GetMapping("/relevant")
    public List<InventoryDrugResponse> relevant(@RequestParam String ownerId, @RequestParam String complaint) {
        return inventoryService.relevant(ownerId, complaint).stream()
                .map(InventoryDrugResponse::from)
                .toList();
    }

    @GetMapping("/low-stock")
    public List<InventoryDrugResponse> lowStock(@RequestParam String ownerId) {
        return inventoryService.lowStock(ownerId).stream()
                .map(InventoryDrugResponse::from)
                .toList();
    }
}
