package personal.slotbook.core.acceptance.support;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.slotbook.core.booking.adapter.out.persistence.BusinessEntity;
import personal.slotbook.core.booking.adapter.out.persistence.JpaBusinessRepository;
import personal.slotbook.core.booking.adapter.out.persistence.JpaStaffRepository;
import personal.slotbook.core.booking.adapter.out.persistence.StaffEntity;

/**
 * 인수 테스트 데이터 준비용 어댑터
 * 업체/직원 등록 API가 없으므로 저장소에 직접 생성
 * 시나리오마다 새 업체를 만들어 데이터와 캐시가 섞이지 않도록 함
 */
@Slf4j
@RequiredArgsConstructor
public class SlotbookTestAdapter {

    private final JpaBusinessRepository businessRepository;
    private final JpaStaffRepository staffRepository;

    public Long createBusiness(String name) {
        Long businessId = businessRepository.save(BusinessEntity.create(name)).getId();
        log.info(">>> Adapter: 업체 생성 - businessId={}, name={}", businessId, name);
        return businessId;
    }

    public Long createStaff(Long businessId, String name) {
        Long staffId = staffRepository.save(StaffEntity.create(businessId, name)).getId();
        log.info(">>> Adapter: 직원 생성 - businessId={}, staffId={}", businessId, staffId);
        return staffId;
    }
}
