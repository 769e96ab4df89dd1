package net.hexproc.core.model;

/**
 * CPU/RAM/HDD/NET 네 차원의 자원량. 모든 차원은 0 이상.
 * 예약(reservation), 가용량(available), 총량(total) 모두 이 타입으로 표현한다.
 */
public record Resources(long cpu, long ram, long hdd, long net) {

    public static final Resources ZERO = new Resources(0, 0, 0, 0);

    public Resources {
        if (cpu < 0 || ram < 0 || hdd < 0 || net < 0) {
            throw new IllegalArgumentException(
                    "resources must be >= 0 on every dimension: cpu=" + cpu + ", ram=" + ram + ", hdd=" + hdd + ", net=" + net);
        }
    }

    public static Resources of(long cpu, long ram, long hdd, long net) {
        return new Resources(cpu, ram, hdd, net);
    }

    public static Resources cpu(long cpu) {
        return new Resources(cpu, 0, 0, 0);
    }

    /** 모든 차원에서 this <= other */
    public boolean fitsWithin(Resources other) {
        return cpu <= other.cpu && ram <= other.ram && hdd <= other.hdd && net <= other.net;
    }

    public Resources plus(Resources o) {
        return new Resources(
                Math.addExact(cpu, o.cpu),
                Math.addExact(ram, o.ram),
                Math.addExact(hdd, o.hdd),
                Math.addExact(net, o.net));
    }

    /** 차원 중 하나라도 음수가 되면 IllegalArgumentException */
    public Resources minus(Resources o) {
        return new Resources(cpu - o.cpu, ram - o.ram, hdd - o.hdd, net - o.net);
    }

    public boolean isZero() {
        return cpu == 0 && ram == 0 && hdd == 0 && net == 0;
    }

    @Override
    public String toString() {
        return "{cpu=" + cpu + ", ram=" + ram + ", hdd=" + hdd + ", net=" + net + '}';
    }
}
