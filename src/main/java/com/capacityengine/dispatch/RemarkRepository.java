package com.capacityengine.dispatch;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RemarkRepository extends JpaRepository<Remark, Long> {

    List<Remark> findBySignerOrderByRemarkIdAsc(String signer);
}
