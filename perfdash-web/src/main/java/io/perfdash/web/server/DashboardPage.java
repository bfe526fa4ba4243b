package io.perfdash.web.server;

import io.perfdash.core.align.SeriesPalette;

import java.util.stream.Collectors;

/**
 * The single-page dashboard served at {@code /}.
 * <p>
 * Client state is one of two view modes. {@code single} shows every metric
 * category of one device; {@code compare} overlays one metric across the
 * selected devices on the server's aligned axis. Transitions happen only
 * through {@code enterSingle} and {@code enterCompare}. A window without data
 * renders a "no data" state, distinct from the error banner.
 */
final class DashboardPage {

    private DashboardPage() {}

    static final String HTML = template().replace("__PALETTE__", palette());

    private static String palette() {
        return SeriesPalette.colors().stream()
                .map(c -> "'" + c + "'")
                .collect(Collectors.joining(",", "[", "]"));
    }

    private static String template() {
        return """
<!DOCTYPE html>
<html lang="en">
<head>
    <meta charset="UTF-8">
    <meta name="viewport" content="width=device-width, initial-scale=1.0">
    <title>PerfDash</title>
    <style>
        *{margin:0;padding:0;box-sizing:border-box}
        body{font-family:-apple-system,BlinkMacSystemFont,'Segoe UI',Roboto,sans-serif;background:#0f1117;color:#e1e4e8}
        .header{background:#161b22;border-bottom:1px solid #30363d;padding:16px 24px;display:flex;align-items:center;justify-content:space-between}
        .header h1{font-size:20px;font-weight:600}
        .header h1 span{color:#58a6ff}
        .badge{padding:4px 12px;border-radius:12px;font-size:12px;font-weight:600;text-transform:uppercase;background:#30363d;color:#8b949e}
        .layout{display:grid;grid-template-columns:280px 1fr;gap:16px;padding:16px 24px}
        .panel{background:#161b22;border:1px solid #30363d;border-radius:8px;padding:16px}
        .panel h3{font-size:14px;color:#8b949e;margin-bottom:12px}
        .dev{display:flex;align-items:center;gap:8px;padding:6px 0;font-size:14px;cursor:pointer}
        .dev small{color:#8b949e;display:block}
        .dev.active{color:#58a6ff}
        .controls{display:flex;flex-wrap:wrap;gap:12px;align-items:center;margin-bottom:16px}
        input,select{background:#0d1117;color:#e1e4e8;border:1px solid #30363d;border-radius:6px;padding:6px 8px;font-size:13px}
        button{padding:8px 16px;border:1px solid #30363d;border-radius:6px;font-size:13px;font-weight:500;cursor:pointer;background:#21262d;color:#e1e4e8}
        .b-go{background:#238636;border-color:#238636;color:#fff}.b-go:hover{background:#2ea043}
        .b-go:disabled{opacity:.5;cursor:not-allowed}
        .cards{display:grid;grid-template-columns:repeat(auto-fit,minmax(180px,1fr));gap:16px;margin-bottom:16px}
        .card{background:#161b22;border:1px solid #30363d;border-radius:8px;padding:16px}
        .card-l{font-size:12px;color:#8b949e;text-transform:uppercase;letter-spacing:.5px;margin-bottom:4px}
        .card-v{font-size:24px;font-weight:700;font-variant-numeric:tabular-nums}
        .card-s{font-size:12px;color:#8b949e;margin-top:4px}
        .chart-box{background:#161b22;border:1px solid #30363d;border-radius:8px;padding:16px;margin-bottom:16px}
        .chart-box h3{font-size:14px;color:#8b949e;margin-bottom:12px}
        canvas{width:100%;height:260px}
        .msg{padding:12px 16px;border-radius:8px;margin-bottom:16px;font-size:14px}
        .msg-error{background:#4a1e1e;color:#f85149}
        .msg-empty{background:#21262d;color:#8b949e}
        .hidden{display:none}
    </style>
</head>
<body>
<div class="header">
    <h1><span>PerfDash</span> Device Performance</h1>
    <span id="mode" class="badge">Single</span>
</div>
<div class="layout">
    <div class="panel">
        <h3>Devices</h3>
        <div id="devices"></div>
    </div>
    <div>
        <div class="controls">
            <label>From <input id="start" type="datetime-local" step="1"></label>
            <label>To <input id="end" type="datetime-local" step="1"></label>
            <button onclick="refresh()">Apply</button>
            <select id="metric"></select>
            <button id="bCmp" class="b-go" onclick="enterCompare()" disabled>Compare selected</button>
            <button id="bSingle" class="hidden" onclick="backToSingle()">Back to device</button>
        </div>
        <div id="error" class="msg msg-error hidden"></div>
        <div id="empty" class="msg msg-empty hidden">No data in the selected time range.</div>
        <div id="cards" class="cards"></div>
        <div id="charts"></div>
    </div>
</div>
<script>
// view = {mode:'single', device} | {mode:'compare', devices, metric}
let view={mode:'single',device:null},devices=[],groups=[],charts=[];
const selected=new Set();
const $=id=>document.getElementById(id);

function bound(id){const v=$(id).value;return v?v.replace('T',' '):''}
function query(extra){
    const p=new URLSearchParams(extra||{});
    if(bound('start'))p.set('start_time',bound('start'));
    if(bound('end'))p.set('end_time',bound('end'));
    return p.toString();
}
async function api(path){
    const r=await fetch(path);const body=await r.json();
    if(!r.ok)throw new Error(body.error||('HTTP '+r.status));
    return body;
}
function showError(m){$('error').textContent=m;$('error').classList.remove('hidden')}
function clearView(){
    charts.forEach(c=>c.destroy());charts=[];
    $('charts').innerHTML='';$('cards').innerHTML='';
    $('error').classList.add('hidden');$('empty').classList.add('hidden');
}
function card(label,value,sub){
    const d=document.createElement('div');d.className='card';
    d.innerHTML='<div class="card-l"></div><div class="card-v"></div><div class="card-s"></div>';
    d.children[0].textContent=label;d.children[1].textContent=value;d.children[2].textContent=sub||'';
    $('cards').appendChild(d);
}
function chart(title,labels,datasets){
    const box=document.createElement('div');box.className='chart-box';
    const h=document.createElement('h3');h.textContent=title;box.appendChild(h);
    const c=document.createElement('canvas');box.appendChild(c);$('charts').appendChild(box);
    charts.push(new Chart(c,{type:'line',data:{labels,datasets},options:{responsive:true,animation:false,spanGaps:true,
        scales:{x:{ticks:{color:'#8b949e',maxTicksLimit:10},grid:{color:'#21262d'}},y:{ticks:{color:'#8b949e'},grid:{color:'#21262d'}}},
        plugins:{legend:{labels:{color:'#e1e4e8'}}}}}));
}

function renderDevices(){
    const box=$('devices');box.innerHTML='';
    devices.forEach(d=>{
        const row=document.createElement('div');row.className='dev'+(view.mode==='single'&&view.device===d.folderName?' active':'');
        const cb=document.createElement('input');cb.type='checkbox';cb.checked=selected.has(d.folderName);
        cb.onclick=e=>{e.stopPropagation();cb.checked?selected.add(d.folderName):selected.delete(d.folderName);$('bCmp').disabled=selected.size<2};
        const t=document.createElement('div');t.innerHTML='<span></span><small></small>';
        t.children[0].textContent=d.displayName;t.children[1].textContent='Android '+d.androidVersion;
        row.appendChild(cb);row.appendChild(t);row.onclick=()=>enterSingle(d.folderName);
        box.appendChild(row);
    });
}

// ─── Transitions ───
function enterSingle(folder){
    view={mode:'single',device:folder};
    $('mode').textContent='Single';$('bSingle').classList.add('hidden');
    renderDevices();refresh();
}
function enterCompare(){
    if(selected.size<2)return;
    view={mode:'compare',devices:[...selected],metric:$('metric').value,back:view.mode==='single'?view.device:null};
    $('mode').textContent='Compare';$('bSingle').classList.remove('hidden');
    renderDevices();refresh();
}
function backToSingle(){enterSingle(view.back||(devices[0]&&devices[0].folderName))}

async function refresh(){
    clearView();
    try{
        if(view.mode==='single')await renderSingle();else await renderCompare();
    }catch(e){showError(e.message)}
}

async function renderSingle(){
    if(!view.device)return;
    const perf=await api('/api/device/'+encodeURIComponent(view.device)+'/performance?'+query());
    if(perf.count===0){$('empty').classList.remove('hidden');return}
    const labels=perf.samples.map(s=>s.timestamp);
    card('Samples',perf.count,labels[0]+' to '+labels[labels.length-1]);
    groups.forEach((g,gi)=>{
        const ds=g.metrics.filter(m=>perf.samples.some(s=>s[m.id]!==undefined)).map((m,i)=>({
            label:m.name,data:perf.samples.map(s=>s[m.id]===undefined?null:s[m.id]),
            borderColor:PALETTE[i%PALETTE.length],backgroundColor:'transparent',tension:.3,pointRadius:0,borderWidth:2}));
        if(ds.length)chart(g.category,labels,ds);
    });
    const a=document.createElement('a');a.href='/api/device/'+encodeURIComponent(view.device)+'/report?'+query({format:'html'});
    a.textContent='Open performance report';a.style.color='#58a6ff';a.target='_blank';$('charts').appendChild(a);
}

async function renderCompare(){
    view.metric=$('metric').value;
    const cmp=await api('/api/compare?'+query({devices:view.devices.join(','),metric:view.metric}));
    if(!cmp.hasData){$('empty').classList.remove('hidden');return}
    cmp.lines.forEach(l=>{
        if(l.summary)card(l.label,l.summary.mean.toFixed(2),'max '+l.summary.max.toFixed(2)+' / min '+l.summary.min.toFixed(2));
        else card(l.label,'-','no data');
    });
    const m=groups.flatMap(g=>g.metrics).find(x=>x.id===cmp.metric);
    chart(m?m.name:cmp.metric,cmp.axis,cmp.lines.map(l=>({label:l.label,data:l.values,borderColor:l.color,
        backgroundColor:l.fill,tension:.3,pointRadius:0,borderWidth:2})));
}

const PALETTE=__PALETTE__;

async function init(){
    try{
        [devices,groups]=await Promise.all([api('/api/devices'),api('/api/metrics?grouped=true')]);
        const sel=$('metric');
        groups.forEach(g=>g.metrics.forEach(m=>{const o=document.createElement('option');o.value=m.id;o.textContent=g.category+' / '+m.name;sel.appendChild(o)}));
        sel.onchange=()=>{if(view.mode==='compare')refresh()};
        if(devices.length)enterSingle(devices[0].folderName);else{renderDevices();$('empty').textContent='No device runs found.';$('empty').classList.remove('hidden')}
    }catch(e){showError(e.message)}
}
const sc=document.createElement('script');sc.src='https://cdn.jsdelivr.net/npm/chart.js@4.4.1/dist/chart.umd.min.js';
sc.onload=init;document.head.appendChild(sc);
</script>
</body>
</html>
""";
    }
}
