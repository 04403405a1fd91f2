package com.pld.mft.catalog.service;

import static com.pld.mft.catalog.service.SchemaConstraints.requireKey;
import static com.pld.mft.catalog.service.SchemaConstraints.requireLength;

import com.pld.mft.catalog.entity.Part;
import com.pld.mft.catalog.entity.Supplier;
import com.pld.mft.catalog.repository.PartRepository;
import com.pld.mft.catalog.repository.SupplierRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SupplierService extends ConstrainedTableService<Supplier, String> {

  private final SupplierRepository supplierRepository;
  private final PartRepository partRepository;
  private final IdGenerator idGenerator;

  public SupplierService(
      SupplierRepository supplierRepository,
      PartRepository partRepository,
      IdGenerator idGenerator) {
    super(supplierRepository, Supplier.TABLE);
    this.supplierRepository = supplierRepository;
    this.partRepository = partRepository;
    this.idGenerator = idGenerator;
  }

  @Transactional(readOnly = true)
  public Optional<Supplier> findByName(String supplierName) {
    return supplierRepository.findFirstBySupplierName(supplierName);
  }

  @Override
  protected void applyDefaults(Supplier row) {
    if (row.getSupplierId() == null) {
      row.setSupplierId(
          idGenerator.newUniqueId(IdGenerator.SUPPLIER, supplierRepository::existsById));
    }
  }

  @Override
  protected String idOf(Supplier row) {
    return row.getSupplierId();
  }

  @Override
  protected void checkKey(String id) {
    requireKey(Supplier.TABLE, "supplier_id", id);
  }

  @Override
  protected void enforceConstraints(Supplier row) {
    requireLength(Supplier.TABLE, "supplier_name", row.getSupplierName(), 200);
    requireLength(Supplier.TABLE, "location", row.getLocation(), 50);
    requireLength(Supplier.TABLE, "city", row.getCity(), 50);
    requireLength(Supplier.TABLE, "street", row.getStreet(), 100);
    requireLength(Supplier.TABLE, "building", row.getBuilding(), 10);
  }

  @Override
  protected List<String> referencingTables(String id) {
    List<String> tables = new ArrayList<>();
    if (partRepository.existsBySupplierId(id)) {
      tables.add(Part.TABLE);
    }
    return tables;
  }
}
