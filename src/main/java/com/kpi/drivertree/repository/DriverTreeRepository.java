package com.kpi.drivertree.repository;

import com.kpi.drivertree.entity.DriverTree;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DriverTreeRepository extends JpaRepository<DriverTree, Long> {
}
